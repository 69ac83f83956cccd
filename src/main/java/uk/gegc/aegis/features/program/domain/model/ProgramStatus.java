package uk.gegc.aegis.features.program.domain.model;

public enum ProgramStatus {
    DRAFT,
    ACTIVE,
    ARCHIVED
}
