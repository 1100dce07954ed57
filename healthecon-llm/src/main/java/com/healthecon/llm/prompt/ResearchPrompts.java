package com.healthecon.llm.prompt;

import com.healthecon.llm.model.ReasoningRequest;
import com.healthecon.llm.model.ReasoningRequest.ContextDocument;

public final class ResearchPrompts {
    
    public static final String SYSTEM_PROMPT = """
        You are a professional researcher preparing a structured, data-driven report on behalf of a global
        health economics team. Your task is to analyze the health question the user poses.
        
        Do:
        - Focus on data-rich insights: include specific figures, trends, statistics, and measurable outcomes
          (e.g., reduction in hospitalization costs, market size, pricing trends, payer adoption).
        - When appropriate, summarize data in a way that could be turned into charts or tables, and call this out
          in the response (e.g., "this would work well as a bar chart comparing per-patient costs across regions").
        - Prioritize reliable, up-to-date sources: peer-reviewed research, health organizations (e.g., WHO, CDC),
          regulatory agencies, or pharmaceutical earnings reports.
        - Include inline citations and return all source metadata.
        - When reference bills are attached, analyze them for billing errors, overcharges, duplicate entries and
          coverage issues, and tie your findings back to the specific bill.
        
        Be analytical, avoid generalities, and ensure that each section supports data-backed reasoning that could
        inform healthcare policy or financial modeling.
        """;
    
    public static final String BILL_ANALYSIS_SYSTEM_PROMPT =
        "You are a bill analysis assistant. Analyze the bill document and provide a concise summary including: "
            + "vendor/company name, total amount, date, and key items or services. "
            + "Be specific and extract exact values when visible.";

    public static final String BILL_ANALYSIS_INSTRUCTION =
        "Please analyze this bill and provide a summary with the following details: "
            + "vendor name, total amount, date, and main items/services.";

    private ResearchPrompts() {}
    
    /**
     * User message: the question followed by one block per attached bill.
     */
    public static String buildUserMessage(ReasoningRequest request) {
        if (request.getContextDocuments() == null || request.getContextDocuments().isEmpty()) {
            return request.getText();
        }
        StringBuilder message = new StringBuilder(request.getText());
        message.append("\n\nReference bills attached to this question:\n");
        int index = 1;
        for (ContextDocument document : request.getContextDocuments()) {
            message.append("\n[Bill ").append(index++).append("] id=").append(document.getId());
            if (document.getFileName() != null) {
                message.append(" file=").append(document.getFileName());
            }
            message.append("\n");
            message.append(document.getSummary() != null && !document.getSummary().isBlank()
                ? document.getSummary()
                : "(no summary available yet)");
            message.append("\n");
        }
        return message.toString();
    }
}
