package com.libragraph.filestore.types;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class ValueTypesTest {

    @Test
    void fromLabelAcceptsLabelsIgnoringCase() {
        assertThat(SortOrder.fromLabel("Filename")).contains(SortOrder.ORIGINAL_NAME);
        assertThat(SortOrder.fromLabel("dateadded")).contains(SortOrder.DATE_ADDED);
    }

    @Test
    void fromLabelAcceptsConstantNames() {
        assertThat(SortOrder.fromLabel("date_added")).contains(SortOrder.DATE_ADDED);
    }

    @Test
    void fromLabelRejectsUnknownAndNull() {
        assertThat(SortOrder.fromLabel("size")).isEmpty();
        assertThat(SortOrder.fromLabel(null)).isEmpty();
    }

    @Test
    void newRecordRejectsNegativeSize() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new NewFileRecord("a.txt", "n", null,
                        Instant.EPOCH, "owner", -1, true))
                .withMessageContaining(">= 0");
    }

    @Test
    void withIdKeepsEveryField() {
        NewFileRecord draft = new NewFileRecord("a.txt", "n", "text/plain",
                Instant.EPOCH, "owner", 3, false);

        FileRecord record = draft.withId(7);

        assertThat(record.id()).isEqualTo(7);
        assertThat(record.originalFilename()).isEqualTo("a.txt");
        assertThat(record.storageName()).isEqualTo("n");
        assertThat(record.mimeType()).isEqualTo("text/plain");
        assertThat(record.size()).isEqualTo(3);
        assertThat(record.isPrivate()).isFalse();
    }

    @Test
    void deleteOutcomeFailedHasNoRecord() {
        DeleteOutcome outcome = DeleteOutcome.failed("gone");
        assertThat(outcome.isDeleted()).isFalse();
        assertThat(outcome.fileRecord()).isNull();
    }
}
