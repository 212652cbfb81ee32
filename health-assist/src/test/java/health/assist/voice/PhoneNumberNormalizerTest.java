package health.assist.voice;

import org.junit.jupiter.api.Test;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class PhoneNumberNormalizerTest {
    private final PhoneNumberNormalizer normalizer = new PhoneNumberNormalizer("91");

    @Test
    void shouldPrefixDomesticTenDigitNumber() {
        assertEquals(Optional.of("+919876543210"), normalizer.normalize("9876543210"));
        assertEquals(Optional.of("+919876543210"), normalizer.normalize("98765 43210"));
    }

    @Test
    void shouldKeepExplicitCountryCode() {
        assertEquals(Optional.of("+16505550100"), normalizer.normalize("+1 650-555-0100"));
    }

    @Test
    void shouldPrefixCountryCodeWithoutPlus() {
        assertEquals(Optional.of("+919876543210"), normalizer.normalize("919876543210"));
        assertEquals(Optional.of("+442071234567"), normalizer.normalize("442071234567 "));
    }

    @Test
    void shouldRejectEmptyInput() {
        assertTrue(normalizer.normalize("").isEmpty());
        assertTrue(normalizer.normalize("   ").isEmpty());
        assertTrue(normalizer.normalize(null).isEmpty());
        assertTrue(normalizer.normalize("+").isEmpty());
        assertTrue(normalizer.normalize("call me").isEmpty());
    }

    @Test
    void shouldMaskAllButLastFourDigits() {
        assertEquals("****3210", PhoneNumberNormalizer.mask("+919876543210"));
        assertEquals("****", PhoneNumberNormalizer.mask("12"));
    }
}
