package com.openforge.fleetcore.memory;

/**
 * A shipping company, operator or manager discussed in the conversation.
 *
 * @param contextSnippet up to two sentences of the answer that mention the company
 */
public record CompanyEntity(
        String name,
        String contextSnippet,
        int    firstMentioned
) {}
