package com.coursesync.scrape.service;

import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Publishes scrape events once the surrounding transaction has committed, so listeners never observe rows
 * that are later rolled back.
 */
@Component
public class ScrapeEventPublisher {
    private final ApplicationEventPublisher publisher;

    public ScrapeEventPublisher(ApplicationEventPublisher publisher) {
        this.publisher = publisher;
    }

    public void publish(Object event) {
        if (event == null) {
            return;
        }
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    publisher.publishEvent(event);
                }
            });
            return;
        }
        publisher.publishEvent(event);
    }
}
