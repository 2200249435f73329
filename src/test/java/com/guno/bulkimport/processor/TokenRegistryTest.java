package com.guno.bulkimport.processor;

import com.guno.bulkimport.exception.RowValidationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class TokenRegistryTest {

    private final TokenRegistry tokens = new TokenRegistry();

    @Test
    void shouldResolveTokenOfProcessedRow() {
        assertThat(tokens.declare("Grouping", "root", 1)).isEmpty();
        tokens.resolved("Grouping", "root", 42L);

        assertThat(tokens.resolve("Grouping.belongs_to.token", "Grouping", "root", 2)).isEqualTo(42L);
    }

    @Test
    void shouldReportDuplicateDeclaration() {
        tokens.declare("Grouping", "root", 1);

        assertThat(tokens.declare("Grouping", "root", 3)).contains("Grouping token 'root' is already used by row 1.");
        assertThat(tokens.isDeclaredBy("Grouping", "root", 1)).isTrue();
        assertThat(tokens.isDeclaredBy("Grouping", "root", 3)).isFalse();
    }

    @Test
    void shouldRejectUnknownForwardSelfAndFailedReferences() {
        tokens.declare("Grouping", "later", 5);
        tokens.declare("Grouping", "self", 2);
        tokens.declare("Grouping", "broken", 1);
        tokens.failed("Grouping", "broken");

        assertThatThrownBy(() -> tokens.resolve("h", "Grouping", "missing", 2))
                .isInstanceOf(RowValidationException.class)
                .hasMessageContaining("no row declares");
        assertThatThrownBy(() -> tokens.resolve("h", "Grouping", "later", 2))
                .hasMessageContaining("row 5, which has not been processed yet");
        assertThatThrownBy(() -> tokens.resolve("h", "Grouping", "self", 2))
                .hasMessageContaining("refers to this same row");
        assertThatThrownBy(() -> tokens.resolve("h", "Grouping", "broken", 2))
                .hasMessageContaining("row 1, which failed");
    }
}
