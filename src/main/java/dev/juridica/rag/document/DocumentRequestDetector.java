package dev.juridica.rag.document;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Detects questions asking for the answer as a downloadable document, in
 * French or English. Explicit phrases are checked first, then a verb followed
 * closely by a document noun. PDF is the default format.
 */
public class DocumentRequestDetector {

    private static final List<String> PHRASES = List.of(
            "génère un document", "genere un document", "générer un document", "crée un document",
            "cree un document", "donne-moi un document", "donne moi un document", "fais-moi un document",
            "rédige un document", "redige un document", "en format pdf", "sous forme de pdf", "au format pdf",
            "en pdf", "en word", "en docx", "generate a document", "create a document", "as a pdf", "as a word",
            "in pdf format", "export to pdf", "download as pdf");

    private static final Pattern VERB_THEN_DOCUMENT = Pattern.compile(
            "\\b(génér|gener|cré|cre|rédig|redig|fais|fai|donne|export|télécharg|telecharg|generate|create|make|"
                    + "write|download|produce)\\w*\\b.{0,40}?\\b(document|pdf|docx|word|fichier|file|rapport|report)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

    private static final Pattern DOCX_KEYWORDS = Pattern.compile("\\b(docx|word)\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);

    public DocumentRequest detect(String query) {
        if (query == null || query.isBlank()) {
            return DocumentRequest.none();
        }
        String normalized = query.toLowerCase(Locale.ROOT);
        boolean request = PHRASES.stream().anyMatch(normalized::contains)
                || VERB_THEN_DOCUMENT.matcher(normalized).find();
        if (!request) {
            return DocumentRequest.none();
        }
        DocumentFormat format = DOCX_KEYWORDS.matcher(normalized).find() ? DocumentFormat.DOCX : DocumentFormat.PDF;
        return new DocumentRequest(true, format);
    }
}
