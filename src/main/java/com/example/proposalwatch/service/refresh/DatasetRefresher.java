package com.example.proposalwatch.service.refresh;

/**
 * Regenerates every protocol dataset. Blocking.
 */
public interface DatasetRefresher {

    /**
     * @throws com.example.proposalwatch.exception.RefreshFailureException when the datasets could not be regenerated
     */
    void refresh();
}
