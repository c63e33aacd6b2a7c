package com.superteacher.grading;

import com.superteacher.models.SubjectArea;

/**
 * CBSE marking guidelines added to the grading instruction for subjects that
 * have specific expectations.
 */
public final class SubjectGuidelines {

    private SubjectGuidelines() {
    }

    public static String forSubject(SubjectArea subject) {
        if (subject == null) {
            return "";
        }
        switch (subject) {
            case ECONOMICS:
                return String.join("\n",
                        "For Economics, follow these CBSE guidelines:",
                        "- Award full marks for complete explanations of economic concepts",
                        "- Award partial marks for partial understanding",
                        "- Check for correct diagrams when required",
                        "- Look for proper economic terminology",
                        "- Evaluate application of economic theories to real-world scenarios",
                        "- Consider the logical structure and flow of the answer");
            case MATH:
                return String.join("\n",
                        "For Mathematics, follow these CBSE guidelines:",
                        "- Award step marks for correct method even when the final answer is wrong",
                        "- Check formulas, units and notation",
                        "- Deduct for missing steps in derivations and proofs");
            case SCIENCE:
            case PHYSICS:
            case CHEMISTRY:
            case BIOLOGY:
                return String.join("\n",
                        "For Science, follow these CBSE guidelines:",
                        "- Check scientific accuracy of definitions and explanations",
                        "- Check labelled diagrams and chemical equations where required",
                        "- Look for correct units and scientific terminology");
            default:
                return "";
        }
    }
}
