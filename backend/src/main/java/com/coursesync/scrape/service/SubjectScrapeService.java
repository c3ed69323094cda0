package com.coursesync.scrape.service;

import com.coursesync.config.ScraperProperties;
import com.coursesync.scrape.model.CourseSearchPage;
import com.coursesync.scrape.model.CourseSnapshot;
import com.coursesync.scrape.model.FailureKind;
import com.coursesync.scrape.model.MeetingTime;
import com.coursesync.scrape.model.SubjectFetch;
import com.coursesync.scrape.upstream.UpstreamClient;
import com.coursesync.scrape.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pages through the upstream course search for one subject.
 */
@Service
public class SubjectScrapeService {
    private static final Logger log = LoggerFactory.getLogger(SubjectScrapeService.class);

    private final UpstreamClient upstreamClient;
    private final ScraperProperties.Upstream config;

    public SubjectScrapeService(UpstreamClient upstreamClient, ScraperProperties properties) {
        this.upstreamClient = upstreamClient;
        this.config = properties.getUpstream();
    }

    public SubjectFetch fetchSubject(String subject, String termCode, int expectedCourses) {
        int pageSize = config.getPageSize();
        Map<String, CourseSnapshot> byCrn = new LinkedHashMap<>();
        int offset = 0;
        int total = expectedCourses > 0 ? expectedCourses : pageSize;
        while (true) {
            if (Thread.currentThread().isInterrupted()) {
                throw new UpstreamException(FailureKind.TIMEOUT, "Scrape of " + subject + " interrupted");
            }
            int expected = Math.max(1, Math.min(pageSize, total - offset));
            CourseSearchPage page = upstreamClient.searchCourses(termCode, subject, offset, pageSize, expected);
            for (CourseSnapshot course : page.courses()) {
                if (course.subject() == null || subject.equals(course.subject())) {
                    byCrn.put(course.crn(), course);
                }
            }
            total = page.totalCount();
            offset += page.courses().size();
            if (page.courses().isEmpty() || offset >= total) {
                break;
            }
            log.debug("Fetched {}/{} courses for {}", offset, total, subject);
        }

        List<CourseSnapshot> courses = new ArrayList<>(byCrn.values());
        if (config.isFetchMissingMeetingTimes()) {
            courses = fillMeetingTimes(termCode, courses);
        }
        return new SubjectFetch(subject, termCode, courses);
    }

    private List<CourseSnapshot> fillMeetingTimes(String termCode, List<CourseSnapshot> courses) {
        List<CourseSnapshot> filled = new ArrayList<>(courses.size());
        for (CourseSnapshot course : courses) {
            if (!course.meetingTimes().isEmpty()) {
                filled.add(course);
                continue;
            }
            List<MeetingTime> times = upstreamClient.getMeetingTimes(termCode, course.crn());
            filled.add(course.withMeetingTimes(times));
        }
        return filled;
    }
}
