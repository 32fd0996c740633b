package madn.core.policy;

import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Component
public class ClinicalDisclaimerPolicy {
    public static final String DISCLAIMER = "This is an AI-assisted diagnostic tool. All outputs must be reviewed by "
            + "qualified healthcare professionals. Do not make clinical decisions based solely on this output.";

    private static final Map<String, String> OVERCONFIDENT = new LinkedHashMap<>();

    static {
        OVERCONFIDENT.put("100% certain", "highly likely");
        OVERCONFIDENT.put("definitely", "most likely");
        OVERCONFIDENT.put("guaranteed", "expected");
        OVERCONFIDENT.put("no need for further testing", "further testing at clinician discretion");
    }

    public String apply(String explanation) {
        String safe = explanation == null ? "" : explanation.trim();
        if (safe.isEmpty()) {
            safe = "Insufficient information to explain this decision. Review the analyzer reports directly.";
        }

        for (Map.Entry<String, String> entry : OVERCONFIDENT.entrySet()) {
            safe = safe.replace(entry.getKey(), entry.getValue());
        }

        if (!safe.contains(DISCLAIMER)) {
            safe = safe + "\n\n" + DISCLAIMER;
        }
        return safe;
    }
}
