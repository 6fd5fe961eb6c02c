package com.hivemind.dispatch.api;

/**
 * Optional body for task lifecycle reports.
 *
 * @param agentId agent that started the task (start reports only)
 * @param reason  failure reason (failure reports only)
 */
public record TaskReportRequest(String agentId, String reason) {}
