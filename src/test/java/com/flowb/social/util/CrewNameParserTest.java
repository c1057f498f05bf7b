package com.flowb.social.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CrewNameParserTest {

    @Test
    void parse_LeadingEmoji_SplitsEmojiAndName() {
        // When
        CrewNameParser.ParsedName parsed = CrewNameParser.parse("🐺 Wolves");

        // Then
        assertThat(parsed.getEmoji()).isEqualTo("🐺");
        assertThat(parsed.getName()).isEqualTo("Wolves");
    }

    @Test
    void parse_NoEmoji_ReturnsTrimmedName() {
        // When
        CrewNameParser.ParsedName parsed = CrewNameParser.parse("  Night Owls ");

        // Then
        assertThat(parsed.getEmoji()).isNull();
        assertThat(parsed.getName()).isEqualTo("Night Owls");
    }

    @Test
    void parse_FlagEmoji_TreatedAsOne() {
        CrewNameParser.ParsedName parsed = CrewNameParser.parse("🇺🇸 Denver Crew");

        assertThat(parsed.getEmoji()).isEqualTo("🇺🇸");
        assertThat(parsed.getName()).isEqualTo("Denver Crew");
    }

    @Test
    void parse_ZwjSequenceWithSkinTone_KeptWhole() {
        String family = "👩🏽‍💻";

        CrewNameParser.ParsedName parsed = CrewNameParser.parse(family + " Builders");

        assertThat(parsed.getEmoji()).isEqualTo(family);
        assertThat(parsed.getName()).isEqualTo("Builders");
    }

    @Test
    void parse_Null_ReturnsEmptyName() {
        CrewNameParser.ParsedName parsed = CrewNameParser.parse(null);

        assertThat(parsed.getEmoji()).isNull();
        assertThat(parsed.getName()).isEmpty();
    }
}
