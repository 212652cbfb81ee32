package health.assist.voice;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Optional;

@Component
public class PhoneNumberNormalizer {
    private static final int DOMESTIC_LENGTH = 10;

    private final String defaultCountryCode;

    public PhoneNumberNormalizer(@Value("${health.assist.voice.default-country-code:91}") String defaultCountryCode) {
        this.defaultCountryCode = digitsOf(defaultCountryCode);
    }

    public Optional<String> normalize(String raw) {
        String value = raw == null ? "" : raw.trim();
        if (value.isEmpty()) {
            return Optional.empty();
        }

        String digits = digitsOf(value);
        if (digits.isEmpty()) {
            return Optional.empty();
        }
        if (value.startsWith("+")) {
            return Optional.of("+" + digits);
        }
        if (digits.length() == DOMESTIC_LENGTH) {
            return Optional.of("+" + defaultCountryCode + digits);
        }
        return Optional.of("+" + digits);
    }

    public static String mask(String phone) {
        if (phone == null || phone.length() <= 4) {
            return "****";
        }
        return "****" + phone.substring(phone.length() - 4);
    }

    private static String digitsOf(String value) {
        StringBuilder digits = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char ch = value.charAt(i);
            if (ch >= '0' && ch <= '9') {
                digits.append(ch);
            }
        }
        return digits.toString();
    }
}
