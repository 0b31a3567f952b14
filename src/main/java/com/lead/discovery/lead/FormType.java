package com.lead.discovery.lead;

public enum FormType {
    CONTACT,
    QUOTE,
    APPLICATION,
    NEWSLETTER,
    LEAD_CAPTURE
}
