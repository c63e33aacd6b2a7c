package com.superteacher.models;

/**
 * Subjects recognised in teacher messages. GENERAL is used when nothing more
 * specific is known.
 */
public enum SubjectArea {
    MATH("Mathematics"),
    SCIENCE("Science"),
    ENGLISH("English"),
    HISTORY("History"),
    SOCIAL_STUDIES("Social Studies"),
    ECONOMICS("Economics"),
    BUSINESS_STUDIES("Business Studies"),
    ACCOUNTANCY("Accountancy"),
    POLITICAL_SCIENCE("Political Science"),
    GEOGRAPHY("Geography"),
    PHYSICS("Physics"),
    CHEMISTRY("Chemistry"),
    BIOLOGY("Biology"),
    COMPUTER_SCIENCE("Computer Science"),
    GENERAL("General");

    private final String displayName;

    SubjectArea(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }
}
