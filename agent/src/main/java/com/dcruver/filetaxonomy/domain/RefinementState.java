package com.dcruver.filetaxonomy.domain;

/**
 * Lifecycle of a category with respect to automatic refinement.
 * USER_EDITED is terminal: once a person has touched a category nothing automatic changes it again.
 */
public enum RefinementState {
    INITIAL,
    REFINING,
    REFINED,
    USER_EDITED
}
