package io.jalali.parser;

/**
 * The three integer fields of a date text, before any calendar validation.
 *
 * @param year the year field
 * @param month the month field
 * @param day the day field
 * @param text the date text the fields were read from
 */
public record RawDate(int year, int month, int day, String text) {}
