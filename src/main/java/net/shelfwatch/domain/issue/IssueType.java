package net.shelfwatch.domain.issue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of defects the ledger tracks, with the merchant-facing copy for each.
 */
public enum IssueType {
    MISSING_PURCHASE_CONTROL(
        "missing_add_to_cart",
        "Add to Cart button may not be working",
        "We couldn't find a working Add to Cart button on this page. Customers may not be able to purchase this product."),
    PURCHASE_CONTROL_NOT_FUNCTIONAL(
        "atc_not_functional",
        "Add to Cart isn't adding items",
        "Clicking Add to Cart did not put the product in the cart. Customers cannot complete a purchase."),
    BROKEN_CHECKOUT(
        "checkout_broken",
        "Checkout may be broken",
        "We couldn't reach checkout from this product. Customers may be unable to pay."),
    VARIANT_SELECTION_BROKEN(
        "variant_selection_broken",
        "Variant selector may have issues",
        "The product variant selector might not be working correctly. Customers may have trouble selecting options."),
    SCRIPT_ERROR(
        "js_error",
        "JavaScript errors detected",
        "We detected JavaScript errors on this page. This may affect functionality and customer experience."),
    TEMPLATE_ERROR(
        "liquid_error",
        "Liquid template errors detected",
        "There may be template errors on this page. Some content might not display correctly."),
    MISSING_IMAGES(
        "missing_images",
        "Product images may not be loading",
        "We couldn't verify that product images are loading correctly. Customers may not see product photos."),
    MISSING_PRICE(
        "missing_price",
        "Price may not be visible",
        "We couldn't find a visible price on this page. Customers may be confused about the cost."),
    SLOW_LOAD(
        "slow_page_load",
        "Page is loading slowly",
        "This page is taking longer than expected to load. This may affect customer experience.");

    private final String code;
    private final String defaultTitle;
    private final String defaultDescription;

    IssueType(String code, String defaultTitle, String defaultDescription) {
        this.code = code;
        this.defaultTitle = defaultTitle;
        this.defaultDescription = defaultDescription;
    }

    /**
     * Stable identifier used in storage and detector payloads.
     */
    public String code() {
        return code;
    }

    public String defaultTitle() {
        return defaultTitle;
    }

    public String defaultDescription() {
        return defaultDescription;
    }

    public static Optional<IssueType> fromCode(String code) {
        if (code == null) {
            return Optional.empty();
        }
        String trimmed = code.trim();
        return Arrays.stream(values()).filter(type -> type.code.equalsIgnoreCase(trimmed)).findFirst();
    }
}
