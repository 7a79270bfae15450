package org.dbsync.migration.selection;

import org.dbsync.model.SyncAction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SelectionInputTest {

    @ParameterizedTest
    @CsvSource({
            "1, STRUCTURE_ONLY",
            "2, STRUCTURE_AND_DATA",
            "s, SKIP",
            "S, SKIP",
            "d, SHOW_DETAILS",
            "' q ', QUIT",
            "structure-and-data, STRUCTURE_AND_DATA"
    })
    void parsesChoices(String token, SelectionInput expected) {
        assertThat(SelectionInput.parse(token)).isEqualTo(expected);
    }

    @Test
    @DisplayName("An empty answer takes the default, skip")
    void blankIsSkip() {
        assertThat(SelectionInput.parse("")).isEqualTo(SelectionInput.SKIP);
        assertThat(SelectionInput.parse(null)).isEqualTo(SelectionInput.SKIP);
    }

    @ParameterizedTest
    @ValueSource(strings = {"3", "yes", "12"})
    void rejectsUnknownTokens(String token) {
        assertThatThrownBy(() -> SelectionInput.parse(token))
                .isInstanceOf(InvalidSelectionInputException.class)
                .hasMessage("Invalid choice '" + token + "'. Expected 1, 2, s, d or q.");
    }

    @Test
    void onlyRecordingInputsCarryAnAction() {
        assertThat(SelectionInput.STRUCTURE_ONLY.action()).isEqualTo(SyncAction.STRUCTURE_ONLY);
        assertThat(SelectionInput.SHOW_DETAILS.action()).isNull();
        assertThat(SelectionInput.QUIT.action()).isNull();
    }
}
