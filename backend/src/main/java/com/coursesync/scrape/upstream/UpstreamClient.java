package com.coursesync.scrape.upstream;

import com.coursesync.scrape.model.CodeDescription;
import com.coursesync.scrape.model.CourseSearchPage;
import com.coursesync.scrape.model.MeetingTime;

import java.util.List;

/**
 * Calls against the upstream registration site. Implementations throw {@link UpstreamException} carrying the
 * failure kind; they handle session rotation themselves.
 */
public interface UpstreamClient {

    List<CodeDescription> getTerms();

    List<CodeDescription> getSubjects(String term);

    List<CodeDescription> getCampuses(String term);

    List<CodeDescription> getInstructionalMethods(String term);

    CourseSearchPage searchCourses(String term, String subject, int offset, int pageSize, int expectedRecords);

    List<MeetingTime> getMeetingTimes(String term, String crn);
}
