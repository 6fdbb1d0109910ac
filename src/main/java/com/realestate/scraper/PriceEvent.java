package com.realestate.scraper;

import java.math.BigDecimal;

/**
 * One entry of a listing's price history.
 * <p>
 * Before normalization {@code eventDate} and {@code eventType} hold the text found on the page;
 * afterwards the date is ISO formatted where recognizable and the type is one of
 * {@code listed, sold, price_change, pending, withdrawn, other}.
 *
 * @author Listing Scraper Team
 * @since 1.0
 */
public record PriceEvent(
    String eventDate,
    String eventType,
    BigDecimal price,
    String notes
) {}
