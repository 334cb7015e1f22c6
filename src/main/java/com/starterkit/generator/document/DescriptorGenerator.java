package com.starterkit.generator.document;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.starterkit.generator.core.JsonSupport;
import com.starterkit.generator.core.model.License;
import com.starterkit.generator.core.model.Order;
import com.starterkit.generator.core.model.Template;

import java.util.Objects;

/**
 * Machine-readable description of the generated configuration.
 */
public class DescriptorGenerator implements DocumentGenerator {

    public static final String DEFAULT_PATH = "starter-config.json";

    private final String path;

    public DescriptorGenerator() {
        this(DEFAULT_PATH);
    }

    public DescriptorGenerator(String path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public GeneratedDocument generate(DocumentContext context) {
        Order order = context.order();
        ObjectNode root = JsonSupport.mapper().createObjectNode();
        root.put("tier", order.getTier());
        root.put("template", order.getTemplate().map(Template::slug).orElse(null));

        ArrayNode features = root.putArray("features");
        context.resolved().allFeatureSlugs().forEach(features::add);

        ObjectNode license = root.putObject("license");
        license.put("key", order.getLicense().map(License::licenseKey).orElse(null));
        license.put("issuedAt", context.generatedAt().toString());
        license.put("orderNumber", order.getOrderNumber());
        license.put("customerEmail", order.getCustomerEmail());

        root.put("generatedAt", context.generatedAt().toString());
        return new GeneratedDocument(path, JsonSupport.toPrettyJson(root));
    }
}
