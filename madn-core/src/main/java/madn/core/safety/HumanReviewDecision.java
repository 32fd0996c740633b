package madn.core.safety;

import java.util.List;

public record HumanReviewDecision(boolean required, List<String> reasons) {
    public HumanReviewDecision {
        reasons = List.copyOf(reasons);
    }
}
