package com.seveninterprise.bcavault.dto;

import java.util.List;

public class EmailMessage {

    private final List<String> to;
    private final String subject;
    private final String text;
    private final String html;

    public EmailMessage(List<String> to, String subject, String text, String html) {
        this.to = to;
        this.subject = subject;
        this.text = text;
        this.html = html;
    }

    public List<String> getTo() {
        return to;
    }

    public String getSubject() {
        return subject;
    }

    public String getText() {
        return text;
    }

    public String getHtml() {
        return html;
    }
}
