package com.realestate.scraper;

/**
 * Immutable contact details of one listing agent. Any component may be null.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public record AgentContact(
    String name,
    String phone,
    String brokerage,
    String email
) {
    /**
     * Returns true when no component carries a non-blank value.
     */
    public boolean isEmpty() {
        return TextUtils.isBlank(name) && TextUtils.isBlank(phone)
            && TextUtils.isBlank(brokerage) && TextUtils.isBlank(email);
    }
}
