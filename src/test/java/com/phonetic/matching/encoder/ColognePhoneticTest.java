package com.phonetic.matching.encoder;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class ColognePhoneticTest {

    private final ColognePhonetic encoder = new ColognePhonetic();

    @ParameterizedTest(name = "{0} -> ''{1}''")
    @CsvSource({
            "Aabjoe, 01",
            "Aaclan, 0856",
            "müller, 657",
            "mÜller, 657",
            "schmidt, 862",
            "Breschnew, 17863",
            "Wikipedia, 3412",
            "mönchengladbach, 664645214",
            "Müller-Lüdenscheidt, 65752682",
            "ß, 8",
            "h, ''",
            "x, 48",
            "cx, 48",
            "Celsius, 8588",
            "Xanthippe, 48621",
            "Zacharias, 8478",
            "Test test, 28282",
            "TesT#Test, 28282"
    })
    void encode(String input, String expected) {
        assertEquals(expected, encoder.encode(input));
    }

    @Test
    @DisplayName("Spelling variants should share a code")
    void variants() {
        assertTrue(encoder.isEncodedEquals("Meyer", "Mayr"));
        assertTrue(encoder.isEncodedEquals("muehle", "mule"));
        assertTrue(encoder.isEncodedEquals("deutsch", "deutz"));
        assertFalse(encoder.isEncodedEquals("Meyer", "Müller"));
    }
}
