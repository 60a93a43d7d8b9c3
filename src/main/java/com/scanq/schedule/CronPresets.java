package com.scanq.schedule;

/**
 * Common 5-field cron expressions.
 */
public final class CronPresets {

    public static final String EVERY_MINUTE = "* * * * *";
    public static final String EVERY_5_MINUTES = "*/5 * * * *";
    public static final String EVERY_15_MINUTES = "*/15 * * * *";
    public static final String EVERY_30_MINUTES = "*/30 * * * *";
    public static final String EVERY_HOUR = "0 * * * *";
    public static final String EVERY_2_HOURS = "0 */2 * * *";
    public static final String EVERY_6_HOURS = "0 */6 * * *";
    public static final String DAILY_MIDNIGHT = "0 0 * * *";
    public static final String DAILY_9AM = "0 9 * * *";
    public static final String DAILY_6PM = "0 18 * * *";
    public static final String WEEKDAYS_9AM = "0 9 * * 1-5";
    public static final String WEEKENDS_10AM = "0 10 * * 0,6";
    public static final String WEEKLY_MONDAY_9AM = "0 9 * * 1";
    public static final String MONTHLY_FIRST_DAY = "0 0 1 * *";

    private CronPresets() {
    }
}
