package dev.juridica.rag.conversation;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Assigns a category to a question from an ordered keyword table. The first
 * category with a matching keyword wins.
 */
public class QueryClassifier {

    public static final String DEFAULT_CATEGORY = "general";

    private static final List<Rule> RULES = List.of(
            new Rule("tax", Set.of("tva", "impôt", "impot", "fiscal", "fiscale", "taxe", "urssaf", "cotisation",
                    "tax", "vat")),
            new Rule("contracts", Set.of("contrat", "convention", "devis", "facture", "prestation", "clause",
                    "contract", "invoice")),
            new Rule("governance", Set.of("statuts", "assemblée", "assemblee", "conseil", "bureau", "président",
                    "president", "vote", "bylaws", "board")),
            new Rule("employment", Set.of("salarié", "salarie", "stagiaire", "étudiant", "etudiant", "rémunération",
                    "remuneration", "employee", "intern")),
            new Rule("legal", Set.of("loi", "article", "juridique", "droit", "légal", "legal", "code",
                    "réglementation", "law")));

    public String classify(String query) {
        if (query == null || query.isBlank()) {
            return DEFAULT_CATEGORY;
        }
        List<String> words = List.of(query.toLowerCase(Locale.ROOT).split("[^\\p{L}\\p{N}]+"));
        for (Rule rule : RULES) {
            if (words.stream().anyMatch(rule.keywords()::contains)) {
                return rule.category();
            }
        }
        return DEFAULT_CATEGORY;
    }

    private record Rule(String category, Set<String> keywords) {
    }
}
