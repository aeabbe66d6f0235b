package com.example.socialdeduction.game.domain.knowledge;

import com.example.socialdeduction.game.domain.GamePhase;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class HiddenKnowledgeStoreTest {

    @Test
    @DisplayName("facts are visible only to their owner, oldest first")
    void factsArePrivate() {
        // given
        HiddenKnowledgeStore store = new HiddenKnowledgeStore();
        store.append(HiddenFact.truth("P1", 1, GamePhase.NIGHT, "P3 is evil"));
        store.append(HiddenFact.fabricated("P1", 2, GamePhase.NIGHT, "P4 is evil"));
        store.append(HiddenFact.truth("P2", 1, GamePhase.NIGHT, "you are the Butler"));

        // when & then
        assertThat(store.textsOf("P1")).containsExactly("P3 is evil", "P4 is evil");
        assertThat(store.textsOf("P2")).containsExactly("you are the Butler");
        assertThat(store.textsOf("P3")).isEmpty();
        assertThat(store.factsOf("P1")).extracting(HiddenFact::reliable).containsExactly(true, false);
    }

    @Test
    @DisplayName("returned lists are snapshots")
    void snapshots() {
        HiddenKnowledgeStore store = new HiddenKnowledgeStore();
        store.append(HiddenFact.truth("P1", 1, GamePhase.DAY, "first"));

        var before = store.factsOf("P1");
        store.append(HiddenFact.truth("P1", 1, GamePhase.DAY, "second"));

        assertThat(before).hasSize(1);
        assertThat(store.size("P1")).isEqualTo(2);
    }
}
