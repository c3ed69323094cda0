package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.persistence.ReferenceDataRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class TermService {
    private final ScraperProperties.Term config;
    private final ReferenceDataRepository referenceDataRepository;

    public TermService(ScraperProperties properties, ReferenceDataRepository referenceDataRepository) {
        this.config = properties.getTerm();
        this.referenceDataRepository = referenceDataRepository;
    }

    /**
     * The configured term, or else the newest upstream term that still accepts registration.
     */
    public String currentTerm() {
        if (config.getCurrent() != null) {
            return config.getCurrent();
        }
        String newest = null;
        for (CodeDescription term : referenceDataRepository.findCategory(ReferenceDataRepository.TERMS)) {
            if (term.isViewOnly()) {
                continue;
            }
            if (newest == null || term.code().compareTo(newest) > 0) {
                newest = term.code();
            }
        }
        return newest;
    }

    public boolean isArchived(String termCode) {
        if (termCode == null) {
            return false;
        }
        List<String> archived = config.getArchived();
        if (archived != null && archived.contains(termCode)) {
            return true;
        }
        for (CodeDescription term : referenceDataRepository.findCategory(ReferenceDataRepository.TERMS)) {
            if (termCode.equals(term.code())) {
                return term.isViewOnly();
            }
        }
        return false;
    }
}
