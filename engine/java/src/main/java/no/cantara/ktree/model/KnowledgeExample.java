package no.cantara.ktree.model;

/**
 * A code sample or scenario illustrating an entry's solution. All fields are optional.
 */
public record KnowledgeExample(
        String title,
        String description,
        String code,
        String language
) {}
