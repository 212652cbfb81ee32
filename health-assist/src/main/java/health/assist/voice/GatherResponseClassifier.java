package health.assist.voice;

import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class GatherResponseClassifier {
    public CallResponse classify(String speechResult, String digits) {
        String spoken = speechResult == null ? "" : speechResult.trim().toLowerCase(Locale.ROOT);
        String pressed = digits == null ? "" : digits.trim();

        boolean taken = !spoken.isEmpty()
                && (spoken.contains("yes") || spoken.contains("haan") || spoken.equals("ha"));
        if ("1".equals(pressed)) {
            taken = true;
        }
        return taken ? CallResponse.TAKEN : CallResponse.MISSED;
    }
}
