package com.coursesync.scrape.model;

public record MeetingTime(
    String beginTime,
    String endTime,
    String days,
    String building,
    String room,
    String startDate,
    String endDate,
    String campus
) {
}
