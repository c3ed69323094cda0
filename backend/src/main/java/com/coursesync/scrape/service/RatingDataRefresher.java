package com.coursesync.scrape.service;

/**
 * Optional collaborator that refreshes instructor rating data on the scheduler's rating interval.
 */
public interface RatingDataRefresher {

    void refresh();
}
