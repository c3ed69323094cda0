package com.coursesync.scrape.service;

import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.persistence.ReferenceDataRepository;
import com.coursesync.scrape.upstream.UpstreamClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

@Service
public class ReferenceDataService {
    private static final Logger log = LoggerFactory.getLogger(ReferenceDataService.class);

    private final UpstreamClient upstreamClient;
    private final ReferenceDataRepository repository;
    private final TermService termService;
    private final Clock clock;

    public ReferenceDataService(
        UpstreamClient upstreamClient,
        ReferenceDataRepository repository,
        TermService termService,
        Clock clock
    ) {
        this.upstreamClient = upstreamClient;
        this.repository = repository;
        this.termService = termService;
        this.clock = clock;
    }

    public String refreshAll() {
        Instant now = clock.instant();
        List<CodeDescription> terms = upstreamClient.getTerms();
        repository.replaceCategory(ReferenceDataRepository.TERMS, terms, now);
        String term = termService.currentTerm();
        if (term == null) {
            log.warn("Reference refresh found no current term among {} upstream terms", terms.size());
            return null;
        }
        refreshSubjects(term);
        List<CodeDescription> campuses = upstreamClient.getCampuses(term);
        repository.replaceCategory(ReferenceDataRepository.CAMPUSES, campuses, now);
        List<CodeDescription> methods = upstreamClient.getInstructionalMethods(term);
        repository.replaceCategory(ReferenceDataRepository.INSTRUCTIONAL_METHODS, methods, now);
        log.info(
            "Reference data refreshed for term {}: {} terms, {} campuses, {} instructional methods",
            term,
            terms.size(),
            campuses.size(),
            methods.size()
        );
        return term;
    }

    public List<CodeDescription> refreshSubjects(String term) {
        List<CodeDescription> subjects = upstreamClient.getSubjects(term);
        repository.replaceCategory(ReferenceDataRepository.SUBJECTS, subjects, clock.instant());
        log.debug("Refreshed {} subjects for term {}", subjects.size(), term);
        return subjects;
    }

    public List<CodeDescription> currentSubjects() {
        return repository.findCategory(ReferenceDataRepository.SUBJECTS);
    }

    public Instant lastRefreshed(String category) {
        return repository.lastRefreshed(category);
    }
}
