package com.bko.planner.execution;

public final class PlannerConstants {

    private PlannerConstants() {
        // Private constructor to prevent instantiation
    }

    // Generation purposes
    public static final String PURPOSE_TASK_PREFIX = "task:";
    public static final String PURPOSE_SYNTHESIS_DRAFT = "task:multi_archetype_synthesis:draft";
    public static final String PURPOSE_SYNTHESIS_VERIFY = "task:multi_archetype_synthesis:verify";
    public static final String PURPOSE_PROMPT_REWRITE = "refinement:prompt-rewrite";

    public static final String INVALID_JSON_RETRY_PROMPT = "\nYour last response was invalid JSON. Return only valid JSON.";
    public static final String NO_NARRATIVE = "None.";
    public static final String NO_PRIOR_OUTPUT = "No upstream task output.";

    public static final String TASK_SYSTEM_TEMPLATE = """
            You are a clinical surveillance planning assistant.
            Domain: %s
            Archetype: %s
            Concern: %s

            Use ONLY the case narrative and upstream task outputs as factual sources.
            Do not invent facts, timestamps, symptoms, or documentation.

            %s
            """;

    public static final String TASK_USER_TEMPLATE = """
            Case narrative:
            %s

            Upstream task outputs:
            %s
            """;

    public static final String SIGNAL_ENRICHMENT_PROMPT = """
            TASK: Extract clinical signals relevant to the concern from the case narrative.
            Group signals into: delay_drivers, outcome_risks, safety_signals, documentation_gaps.
            For each signal give a short id, a clinical description, a trigger expression that names the
            structured field it would be read from (for example lab.result, device.status, order.code) and the
            exact narrative snippet that supports it.
            Return only JSON matching the required schema.
            """;

    public static final String EVENT_SUMMARY_PROMPT = """
            TASK: Produce a factual, timeline-focused summary of the events relevant to the concern.
            Structure the narrative chronologically. Flag delays, gaps, or safety concerns.
            Do not lecture about protocols; state what happened and when.
            Return only JSON matching the required schema.
            """;

    public static final String SUMMARY_20_80_PROMPT = """
            TASK: Write a two-paragraph summary. The first paragraph states the 20 percent of findings that
            explain 80 percent of the case for a reviewer. The second paragraph lists remaining open items.
            Return plain text only.
            """;

    public static final String FOLLOWUP_QUESTIONS_PROMPT = """
            TASK: Write three to seven follow-up questions a clinical reviewer should ask to close the gaps in
            this case. Questions must be answerable from the chart. Do not speculate about blame.
            Return only JSON matching the required schema.
            """;

    public static final String CLINICAL_REVIEW_PLAN_PROMPT = """
            TASK: Propose the clinical review plan for this case: the reference tools a reviewer should apply
            and the review criteria with the source supporting each criterion.
            Return only JSON of the form:
            {"clinical_tools": [{"tool_id": "", "name": "", "use_case": ""}],
             "review_criteria": [{"rule_id": "", "description": "", "provenance": ""}]}
            """;

    public static final String SYNTHESIS_DRAFT_PROMPT = """
            TASK: Merge the findings of the analysis lanes below into one set of signal groups.
            Remove duplicates, keep the strongest evidence for each signal and note conflicts between lanes.
            Return only JSON matching the required schema.
            """;

    public static final String SYNTHESIS_VERIFY_PROMPT = """
            TASK: Verify the draft synthesis below against the lane findings. Remove any signal that is not
            supported by a lane finding, correct misattributed evidence, and record each change in
            verification_notes. Return the corrected synthesis as JSON matching the required schema.

            Draft synthesis:
            %s
            """;

    public static final String SIGNAL_GROUPS_SCHEMA_FRAGMENT = """
            {
              "type": "array",
              "items": {
                "type": "object",
                "properties": {
                  "group_id": {"type": "string"},
                  "signals": {
                    "type": "array",
                    "items": {
                      "type": "object",
                      "properties": {
                        "signal_id": {"type": "string"},
                        "description": {"type": "string"},
                        "trigger_expr": {"type": "string"},
                        "evidence_type": {"type": "string"},
                        "provenance": {"type": "string"}
                      },
                      "required": ["signal_id", "description", "trigger_expr", "evidence_type", "provenance"],
                      "additionalProperties": false
                    }
                  }
                },
                "required": ["group_id", "signals"],
                "additionalProperties": false
              }
            }""";

    public static final String SIGNAL_ENRICHMENT_SCHEMA = """
            {
              "type": "object",
              "properties": {"signal_groups": %s},
              "required": ["signal_groups"],
              "additionalProperties": false
            }
            """.formatted(SIGNAL_GROUPS_SCHEMA_FRAGMENT);

    public static final String EVENT_SUMMARY_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "event_summary": {"type": "string"},
                "timeline_complete": {"type": "boolean"},
                "key_timestamps": {"type": "array", "items": {"type": "string"}}
              },
              "required": ["event_summary", "timeline_complete", "key_timestamps"],
              "additionalProperties": false
            }
            """;

    public static final String FOLLOWUP_QUESTIONS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "followup_questions": {"type": "array", "items": {"type": "string"}}
              },
              "required": ["followup_questions"],
              "additionalProperties": false
            }
            """;

    public static final String SYNTHESIS_SCHEMA = """
            {
              "type": "object",
              "properties": {
                "merged_signal_groups": %s,
                "synthesis_summary": {"type": "string"},
                "verification_notes": {"type": "array", "items": {"type": "string"}}
              },
              "required": ["merged_signal_groups", "synthesis_summary", "verification_notes"],
              "additionalProperties": false
            }
            """.formatted(SIGNAL_GROUPS_SCHEMA_FRAGMENT);

    // Prompt refinement
    public static final String PROMPT_OPTIMIZER_SYSTEM_PROMPT = """
            You are a prompt engineer improving a clinical extraction prompt. You are given the current prompt,
            its score on a frozen evaluation batch and the failures it produced.
            Rewrite the prompt to fix the failures without overfitting to individual cases.
            Return only JSON of the form:
            {"analysis": "", "new_prompt": "", "expected_improvements": [""]}
            """;

    public static final String PROMPT_OPTIMIZER_USER_TEMPLATE = """
            Task type: %s
            Current score: %s

            Current prompt:
            %s

            Failure evidence:
            %s
            %s
            """;

    public static final String REGRESSION_GUIDANCE = """

            The last change made the score worse (delta %s). Revert the direction of that change and make a
            smaller, more targeted edit.
            """;
}
