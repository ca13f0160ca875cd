package ca.carms.residency.entity;

import java.util.Arrays;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fixed vocabulary of program description sections.
 * <p>
 * Each constant maps 1:1 to a wide column of the x_section extract. Declaration
 * order is the display precedence used when a program's sections are returned.
 */
public enum SectionName {

    PROGRAM_HIGHLIGHTS("program_highlights"),
    PROGRAM_GOALS("program_goals"),
    PROGRAM_CURRICULUM("program_curriculum"),
    TRAINING_SITES("training_sites"),
    ELECTIVES("electives"),
    CALL_SCHEDULE("call_schedule"),
    RESEARCH("research"),
    EVALUATION("evaluation"),
    RESIDENT_WELLNESS("resident_wellness"),
    ADDITIONAL_INFORMATION("additional_information"),
    RETURN_OF_SERVICE("return_of_service"),
    GENERAL_INSTRUCTIONS("general_instructions"),
    SUPPORTING_DOCUMENTATION_INFORMATION("supporting_documentation_information"),
    REVIEW_PROCESS("review_process"),
    SELECTION_CRITERIA("selection_criteria"),
    INTERVIEWS("interviews"),
    IMPORTANT_DATES("important_dates"),
    PROGRAM_CONTRACTS("program_contracts"),
    CONTACT_INFORMATION("contact_information"),
    FAQ("faq"),
    SUMMARY_OF_CHANGES("summary_of_changes");

    private static final Map<String, SectionName> BY_COLUMN = Collections.unmodifiableMap(
        Arrays.stream(values()).collect(Collectors.toMap(SectionName::columnName, Function.identity())));

    private final String columnName;

    SectionName(String columnName) {
        this.columnName = columnName;
    }

    /**
     * Source column name, also the value stored in section_name.
     */
    public String columnName() {
        return columnName;
    }

    public static Optional<SectionName> fromColumn(String column) {
        return Optional.ofNullable(BY_COLUMN.get(column));
    }
}
