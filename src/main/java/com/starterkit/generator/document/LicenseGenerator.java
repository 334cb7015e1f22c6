package com.starterkit.generator.document;

import com.starterkit.generator.core.model.License;
import com.starterkit.generator.core.model.Order;

import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Objects;
import java.util.Optional;

/**
 * Human-readable license document. Orders without a license render {@code N/A}
 * in the license-specific fields so the layout never changes.
 */
public class LicenseGenerator implements DocumentGenerator {

    public static final String DEFAULT_PATH = "LICENSE.md";
    static final String NOT_AVAILABLE = "N/A";

    private final String path;

    public LicenseGenerator() {
        this(DEFAULT_PATH);
    }

    public LicenseGenerator(String path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public GeneratedDocument generate(DocumentContext context) {
        Order order = context.order();
        Optional<License> license = order.getLicense();
        String product = context.productName();

        String content = """
                # %s License

                ## License Information

                - **License Key:** %s
                - **Order Number:** %s
                - **Licensed To:** %s
                - **Email:** %s
                - **Tier:** %s
                - **Issue Date:** %s
                - **Expires:** %s
                - **Status:** %s

                ## License Terms

                This license grants you the right to:

                1. **Use** - Use the purchased code in unlimited personal and commercial projects
                2. **Modify** - Modify and customize the code for your projects
                3. **Deploy** - Deploy applications built with this code without restrictions

                This license does NOT grant you the right to:

                1. **Redistribute** - Sell, share, or redistribute the source code
                2. **Transfer** - Transfer this license to another person or organization
                3. **Sublicense** - Grant sublicenses to third parties

                ## Support

                For support inquiries, please contact us with your order number.

                ## Validity

                This license is valid for lifetime use with the purchased tier and features.

                ---

                Generated by %s
                """.formatted(
                product,
                license.map(License::licenseKey).orElse(NOT_AVAILABLE),
                order.getOrderNumber(),
                order.getLicensee(),
                order.getCustomerEmail(),
                context.tierDisplayName(),
                context.issueDate(),
                license.map(LicenseGenerator::expiry).orElse(NOT_AVAILABLE),
                license.map(l -> l.status().name()).orElse(NOT_AVAILABLE),
                product);

        return new GeneratedDocument(path, content);
    }

    private static String expiry(License license) {
        if (license.expiresAt() == null) {
            return "Never";
        }
        return DateTimeFormatter.ISO_LOCAL_DATE.format(license.expiresAt().atOffset(ZoneOffset.UTC));
    }
}
