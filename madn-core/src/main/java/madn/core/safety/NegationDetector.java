package madn.core.safety;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.regex.Pattern;

@Component
public class NegationDetector {
    public static final int DEFAULT_WINDOW = 30;

    private static final List<Pattern> CUES = List.of(
            Pattern.compile("\\bno\\b"),
            Pattern.compile("\\bnot\\b"),
            Pattern.compile("\\bwithout\\b"),
            Pattern.compile("\\babsent\\b"),
            Pattern.compile("\\bnegative\\b"),
            Pattern.compile("\\brules?\\s*out\\b"),
            Pattern.compile("\\bdenies?\\b"),
            Pattern.compile("\\bexcludes?\\b"),
            Pattern.compile("\\bno\\s*evidence\\b"),
            Pattern.compile("\\bunremarkable\\b"),
            Pattern.compile("\\bnormal\\b")
    );

    private final int window;

    public NegationDetector(@Value("${madn.text.negation-window:30}") int window) {
        if (window < 0) {
            throw new IllegalArgumentException("negation window must not be negative: " + window);
        }
        this.window = window;
    }

    public int window() {
        return window;
    }

    public boolean isNegated(String lowerText, int matchStart) {
        String prefix = lowerText.substring(Math.max(0, matchStart - window), matchStart);
        for (Pattern cue : CUES) {
            if (cue.matcher(prefix).find()) {
                return true;
            }
        }
        return false;
    }
}
