package com.starksync.sync.state;

/**
 * Opens the global state trie and per-contract storage tries over the node store.
 */
public interface TrieFactory {

    StateTrie stateTrie();

    StateTrie storageTrie(String contractAddress);
}
