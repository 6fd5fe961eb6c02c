package com.hivemind.core.planning;

import com.hivemind.core.model.Priority;
import com.hivemind.core.model.TaskType;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered task templates, one per {@link TaskType}. The first entry of every template is the
 * requirements analysis and receives the objective description.
 */
final class TaskTemplates {

    record Entry(String content, Priority priority) {}

    private static final Map<TaskType, List<Entry>> TEMPLATES = new EnumMap<>(TaskType.class);

    static {
        TEMPLATES.put(TaskType.INTERACTIVE_COMPONENT, List.of(
                new Entry("Analyze widget requirements: %s", Priority.HIGH),
                new Entry("Design widget HTML template structure", Priority.HIGH),
                new Entry("Implement server-side data processing logic", Priority.HIGH),
                new Entry("Create client-side controller script", Priority.HIGH),
                new Entry("Style widget with responsive CSS", Priority.MEDIUM),
                new Entry("Test widget functionality with mock data", Priority.HIGH),
                new Entry("Deploy widget to the platform instance", Priority.HIGH),
                new Entry("Validate deployment and run integration tests", Priority.MEDIUM)));

        TEMPLATES.put(TaskType.PROCESS_AUTOMATION, List.of(
                new Entry("Analyze workflow requirements: %s", Priority.HIGH),
                new Entry("Design workflow trigger conditions and events", Priority.HIGH),
                new Entry("Map out workflow steps and decision points", Priority.HIGH),
                new Entry("Configure approval rules and approver assignments", Priority.HIGH),
                new Entry("Configure workflow actions and notifications", Priority.MEDIUM),
                new Entry("Set up data transformations and variables", Priority.MEDIUM),
                new Entry("Test workflow with mock scenarios", Priority.HIGH),
                new Entry("Deploy and activate workflow", Priority.HIGH)));

        TEMPLATES.put(TaskType.SCRIPT, List.of(
                new Entry("Analyze script requirements: %s", Priority.HIGH),
                new Entry("Identify target tables and execution context", Priority.HIGH),
                new Entry("Design script logic and function outline", Priority.HIGH),
                new Entry("Implement business rule or script include", Priority.HIGH),
                new Entry("Add error handling and logging to the script", Priority.MEDIUM),
                new Entry("Test script with mock records", Priority.HIGH),
                new Entry("Deploy script to the platform instance", Priority.HIGH),
                new Entry("Validate script behaviour against existing data", Priority.MEDIUM)));

        TEMPLATES.put(TaskType.APPLICATION, List.of(
                new Entry("Analyze application requirements: %s", Priority.HIGH),
                new Entry("Design application data model and module structure", Priority.HIGH),
                new Entry("Create tables and server-side business logic", Priority.HIGH),
                new Entry("Build client-side portal controller for the application UI", Priority.HIGH),
                new Entry("Style application pages with responsive CSS", Priority.MEDIUM),
                new Entry("Configure workflow automation for application processes", Priority.MEDIUM),
                new Entry("Test application end to end with mock data", Priority.HIGH),
                new Entry("Deploy application and validate installation", Priority.HIGH)));

        TEMPLATES.put(TaskType.INTEGRATION, List.of(
                new Entry("Analyze integration requirements: %s", Priority.HIGH),
                new Entry("Research external API endpoints and authentication", Priority.HIGH),
                new Entry("Design REST message payloads and field mapping", Priority.HIGH),
                new Entry("Configure outbound integration connection and credentials", Priority.HIGH),
                new Entry("Implement transform script for inbound data", Priority.HIGH),
                new Entry("Add retry and error handling for external calls", Priority.MEDIUM),
                new Entry("Test integration with mock responses", Priority.HIGH),
                new Entry("Validate end to end integration test scenarios", Priority.MEDIUM)));

        TEMPLATES.put(TaskType.ACCESS_CONTROL, List.of(
                new Entry("Analyze access requirements: %s", Priority.HIGH),
                new Entry("Identify affected tables and operations", Priority.HIGH),
                new Entry("Design role and ACL hierarchy", Priority.HIGH),
                new Entry("Create ACL rules for table access", Priority.HIGH),
                new Entry("Assign roles to user groups", Priority.MEDIUM),
                new Entry("Test access with impersonated users", Priority.HIGH),
                new Entry("Deploy access rules to the platform instance", Priority.HIGH),
                new Entry("Validate permissions and document the security changes", Priority.MEDIUM)));

        TEMPLATES.put(TaskType.GENERIC, List.of(
                new Entry("Analyze requirements: %s", Priority.HIGH),
                new Entry("Research existing platform capabilities", Priority.MEDIUM),
                new Entry("Design solution architecture", Priority.HIGH),
                new Entry("Implement core functionality logic", Priority.HIGH),
                new Entry("Add error handling and logging", Priority.MEDIUM),
                new Entry("Create documentation", Priority.LOW),
                new Entry("Test solution with mock scenarios", Priority.HIGH),
                new Entry("Deploy and validate the solution", Priority.HIGH)));
    }

    private TaskTemplates() {}

    static List<Entry> forType(TaskType type) {
        return TEMPLATES.getOrDefault(type, TEMPLATES.get(TaskType.GENERIC));
    }
}
