package com.soliditydfg.analyzer.dfg;

/**
 * Edge endpoints that stand for entities outside the analyzed unit. They are never
 * materialized as nodes and are valid targets, not dangling references.
 *
 *   contract_<baseName>   inherited base contract
 *   init_<nodeId>         initializer flow of a variable declaration
 */
public final class SyntheticIds {

    public static final String BASE_CONTRACT_PREFIX = "contract_";
    public static final String INITIALIZER_PREFIX = "init_";

    private SyntheticIds() {}

    public static String forBaseContract(String baseName) {
        return BASE_CONTRACT_PREFIX + baseName;
    }

    public static String forInitializer(String nodeId) {
        return INITIALIZER_PREFIX + nodeId;
    }

    public static boolean isSynthetic(String id) {
        return id != null && (id.startsWith(BASE_CONTRACT_PREFIX) || id.startsWith(INITIALIZER_PREFIX));
    }
}
