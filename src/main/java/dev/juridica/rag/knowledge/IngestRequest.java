package dev.juridica.rag.knowledge;

import java.util.List;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;

public record IngestRequest(@NotEmpty List<@Valid KnowledgeDocument> documents) {
}
