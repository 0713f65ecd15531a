package dev.juridica.rag.conversation;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class QueryClassifierTest {

    private final QueryClassifier classifier = new QueryClassifier();

    @Test
    void classifiesByKeyword() {
        assertThat(classifier.classify("Quel est le taux de TVA sur une prestation ?")).isEqualTo("tax");
        assertThat(classifier.classify("Qui convoque l'assemblée générale ?")).isEqualTo("governance");
        assertThat(classifier.classify("Un étudiant peut-il être rémunéré ?")).isEqualTo("employment");
        assertThat(classifier.classify("Que dit l'article 3 de la loi ?")).isEqualTo("legal");
    }

    @Test
    void firstMatchingCategoryWins() {
        assertThat(classifier.classify("Le bureau peut-il signer un contrat ?")).isEqualTo("contracts");
    }

    @Test
    void matchesWholeWordsOnly() {
        assertThat(classifier.classify("Comment fonctionne la coloration syntaxique ?")).isEqualTo("general");
    }

    @Test
    void defaultsToGeneral() {
        assertThat(classifier.classify("Bonjour")).isEqualTo(QueryClassifier.DEFAULT_CATEGORY);
        assertThat(classifier.classify("  ")).isEqualTo(QueryClassifier.DEFAULT_CATEGORY);
        assertThat(classifier.classify(null)).isEqualTo(QueryClassifier.DEFAULT_CATEGORY);
    }
}
