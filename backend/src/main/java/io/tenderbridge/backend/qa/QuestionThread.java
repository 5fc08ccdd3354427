package io.tenderbridge.backend.qa;

/**
 * A question together with its answer.
 *
 * @param answer null while unanswered, or when answers were not requested
 */
public record QuestionThread(TenderQuestion question, TenderAnswer answer) {}
