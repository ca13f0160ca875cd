package ca.carms.residency.repository;

/**
 * Projection of a persisted natural key and the surrogate id assigned to it.
 */
public interface NaturalKeyIdentity {

    String getNaturalKey();

    Integer getId();
}
