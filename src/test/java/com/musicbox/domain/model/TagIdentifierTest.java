package com.musicbox.domain.model;

import com.musicbox.domain.exception.ValidationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class TagIdentifierTest {

    @Test
    void normalizesSeparatorsAndCase() {
        assertEquals("04f7eda4df6181", TagIdentifier.parse("04:F7:ED:A4:DF:61:81").uid());
        assertEquals("04f7eda4df6181", TagIdentifier.parse("04-f7-ed-a4-df-61-81").uid());
        assertEquals("04f7eda4df6181", TagIdentifier.parse("04 F7 ED A4 DF 61 81").uid());
    }

    @Test
    void differentSpellingsAreTheSameTag() {
        assertEquals(TagIdentifier.parse("ABCD1234EF"), TagIdentifier.parse("ab:cd:12:34:ef"));
        assertEquals(TagIdentifier.parse("ABCD1234EF").hashCode(), TagIdentifier.parse("abcd1234ef").hashCode());
    }

    @ParameterizedTest
    @ValueSource(strings = { "", "   ", "::", "abc", "12-3", "04f7zz", "mock_tag_001" })
    void rejectsInvalidUids(String raw) {
        assertThrows(ValidationException.class, () -> TagIdentifier.parse(raw));
    }

    @Test
    void rejectsNull() {
        assertThrows(ValidationException.class, () -> TagIdentifier.parse(null));
    }

    @Test
    void buildsFromRawBytes() {
        byte[] bytes = { 0x04, (byte) 0xF7, (byte) 0xED, (byte) 0xA4 };
        assertEquals("04f7eda4", TagIdentifier.fromRawBytes(bytes).uid());
        assertThrows(ValidationException.class, () -> TagIdentifier.fromRawBytes(new byte[0]));
    }

    @Test
    void toStringIsTheNormalizedUid() {
        assertEquals("abcd1234ef", TagIdentifier.parse("AB:CD:12:34:EF").toString());
    }
}
