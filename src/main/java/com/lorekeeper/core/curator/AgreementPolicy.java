package com.lorekeeper.core.curator;

/**
 * Measures how far apart two claims about the same Canon key are.
 */
@FunctionalInterface
public interface AgreementPolicy {

    /**
     * @return disagreement in [0,1]; 0 means the claims say the same thing
     */
    double disagreement(String a, String b);
}
