package com.starksync.sync.config;

/**
 * Well-known L1 deployments, selected by chain id.
 */
public enum L1Network {

    MAINNET(1L,
            "0xa739B175325cCA7b71fcB51C3032935Ef7Ac338F",
            "0x96375087b2F6eFc59e5e0dd5111B4d090EBFDD8B",
            13_627_000L),
    GOERLI(5L,
            "0x5EF3C980Bf970FcE5BbC217835743ea9f0388f4F",
            "0x743789ff2fF82Bfb907009C9911a7dA636D34FA7",
            5_853_000L);

    private final long chainId;
    private final String gpsVerifierAddress;
    private final String memoryPageRegistryAddress;
    private final long deploymentBlock;

    L1Network(long chainId, String gpsVerifierAddress, String memoryPageRegistryAddress, long deploymentBlock) {
        this.chainId = chainId;
        this.gpsVerifierAddress = gpsVerifierAddress;
        this.memoryPageRegistryAddress = memoryPageRegistryAddress;
        this.deploymentBlock = deploymentBlock;
    }

    /**
     * Chain 1 is mainnet; every other chain uses the Goerli deployment.
     */
    public static L1Network fromChainId(long chainId) {
        return chainId == MAINNET.chainId ? MAINNET : GOERLI;
    }

    public long getChainId() {
        return chainId;
    }

    public String getGpsVerifierAddress() {
        return gpsVerifierAddress;
    }

    public String getMemoryPageRegistryAddress() {
        return memoryPageRegistryAddress;
    }

    public long getDeploymentBlock() {
        return deploymentBlock;
    }
}
