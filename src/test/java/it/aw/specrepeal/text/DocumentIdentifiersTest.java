package it.aw.specrepeal.text;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentIdentifiersTest {

    @Test
    void prefixedNumbers() {
        assertThat(DocumentIdentifiers.prefixedNumber("See Document 022178 for details")).isEqualTo("022178");
        assertThat(DocumentIdentifiers.prefixedNumber("TD-022178")).isEqualTo("022178");
        assertThat(DocumentIdentifiers.prefixedNumber("Doc. No. 015225")).isEqualTo("015225");
        assertThat(DocumentIdentifiers.prefixedNumber("pole height 45 feet")).isNull();
    }

    @Test
    void bareSixDigitNumberIsAcceptedOnlyAsFallback() {
        assertThat(DocumentIdentifiers.documentNumber("Guys 022178 REV 13.pdf")).isEqualTo("022178");
        assertThat(DocumentIdentifiers.documentNumber("value 1022178 and 3.141592")).isNull();
        assertThat(DocumentIdentifiers.documentNumber(null)).isNull();
    }

    @Test
    void revisions() {
        assertThat(DocumentIdentifiers.revision("Guys 022178 REV 13")).isEqualTo("13");
        assertThat(DocumentIdentifiers.revision("Revision: 4A")).isEqualTo("4A");
        assertThat(DocumentIdentifiers.revision("reviewed by crew")).isNull();
    }
}
