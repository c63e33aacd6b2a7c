package com.superteacher.utils;

import com.superteacher.models.ImageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * Offline vision client returning canned text. The prompt decides between a
 * question paper and an answer sheet; the image's file name or URL picks the
 * subject.
 */
public class DemoVisionClient implements VisionClient {
    private static final Logger logger = LoggerFactory.getLogger(DemoVisionClient.class);

    static final String ECONOMICS_PAPER = String.join("\n",
            "CENTRAL BOARD OF SECONDARY EDUCATION",
            "Class XII Economics - Periodic Test",
            "Time: 1 hour 30 minutes          Maximum Marks: 40",
            "SECTION A",
            "1. Define marginal propensity to consume. [2 marks]",
            "2. What is meant by ex-ante savings? [2 marks]",
            "3. State two functions of the central bank. [2 marks]",
            "4. What is a fixed exchange rate? [2 marks]",
            "5. Define aggregate demand. [2 marks]",
            "SECTION B",
            "6. Explain the investment multiplier with an example. [3 marks]",
            "7. Distinguish between revenue deficit and fiscal deficit. [3 marks]",
            "8. Explain the role of the repo rate in controlling credit. [3 marks]",
            "9. What are the components of the current account? [3 marks]",
            "10. Explain the paradox of thrift. [3 marks]",
            "SECTION C",
            "11. Explain the determination of equilibrium income with a diagram. [5 marks]",
            "12. Discuss the measures to correct excess demand. [5 marks]",
            "13. Explain the objectives of a government budget. [5 marks]");

    static final String GENERAL_PAPER = String.join("\n",
            "Class X Science - Class Test",
            "Maximum Marks: 20",
            "Q1. What is photosynthesis? (2 marks)",
            "Q2. Name the products of respiration. (2 marks)",
            "Q3. Explain the structure of a neuron with a labelled diagram. (5 marks)",
            "Q4. Why is the sky blue? (3 marks)",
            "Q5. Describe the process of digestion in the stomach. (3 marks)",
            "Q6. State Ohm's law and give its formula. (5 marks)");

    static final String ECONOMICS_ANSWER = "Marginal propensity to consume is the ratio of the change in consumption "
            + "to the change in income, MPC = change in C / change in Y. For example if income rises by 100 and "
            + "consumption rises by 80 then MPC is 0.8. It always lies between 0 and 1. The investment multiplier "
            + "is 1 / (1 - MPC), so a higher MPC gives a higher multiplier and a bigger rise in income.";

    static final String GENERAL_ANSWER = "Photosynthesis is the process by which green plants make their own food "
            + "using sunlight, carbon dioxide and water in the presence of chlorophyll. Oxygen is released as a "
            + "by-product. It takes place mainly in the leaves inside the chloroplasts.";

    @Override
    public String extractText(ImageSource image, String prompt) {
        boolean paper = prompt != null && prompt.toLowerCase(Locale.ROOT).contains("question paper");
        boolean economics = image.hint().toLowerCase(Locale.ROOT).contains("econ");
        logger.info("Demo vision returning canned {} {} text for {}",
                economics ? "economics" : "general", paper ? "paper" : "answer", image.hint());
        if (paper) {
            return economics ? ECONOMICS_PAPER : GENERAL_PAPER;
        }
        return economics ? ECONOMICS_ANSWER : GENERAL_ANSWER;
    }
}
