package com.ryuqq.icnp.adapter.inmemory.rollback;

import com.ryuqq.icnp.core.spi.RollbackStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryRollbackJournal 테스트.
 *
 * @author ICNP Team
 * @since 1.0.0
 */
class InMemoryRollbackJournalTest {

    @Test
    void rollback_요청을_순서대로_기록() {
        InMemoryRollbackJournal journal = new InMemoryRollbackJournal();

        assertThat(journal.rollback("inv-1")).isEqualTo(RollbackStatus.OK);
        assertThat(journal.rollback("inv-2")).isEqualTo(RollbackStatus.OK);

        assertThat(journal.rolledBack()).containsExactly("inv-1", "inv-2");
    }

    @Test
    void rollback_failFor_지정시_ERROR() {
        InMemoryRollbackJournal journal = new InMemoryRollbackJournal().failFor("inv-9");

        assertThat(journal.rollback("inv-9")).isEqualTo(RollbackStatus.ERROR);
        assertThat(journal.rolledBack()).containsExactly("inv-9");
    }
}
