package com.starksync.sync.l1;

/**
 * The three L1 contracts whose events feed fact resolution.
 */
public enum WatchedContract {

    STATE("LogStateTransitionFact",
            "0x9866f8ddfe70bb512b2f2b28b49d4017c43f7ba775f1a20c61c13eea8cdac111"),
    GPS_VERIFIER("LogMemoryPagesHashes",
            "0x73b132cb33951232d83dc0f1f81c2d10f9a2598f057404ed02756716092097bb"),
    MEMORY_PAGE_REGISTRY("LogMemoryPageFactContinuous",
            "0xb8b9c39aeba1cfd98c38dfeebe11c2f7e02b334cbe9f05f22b442a5d9c1ea0c5");

    private final String eventName;
    private final Hash32 topic;

    WatchedContract(String eventName, String topic) {
        this.eventName = eventName;
        this.topic = Hash32.fromHex(topic);
    }

    public String getEventName() {
        return eventName;
    }

    /**
     * Keccak-256 of the event signature, i.e. topic 0 of every log it emits.
     */
    public Hash32 getTopic() {
        return topic;
    }
}
