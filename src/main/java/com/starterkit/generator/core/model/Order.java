package com.starterkit.generator.core.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Unit of work for one generation: what the buyer purchased and who they are.
 * Read-only input; the generator never mutates an order.
 */
public final class Order {
    private final String id;
    private final String orderNumber;
    private final String tier;
    private final List<String> selectedFeatures;
    private final String customerName;
    private final String customerEmail;
    private final BigDecimal total;
    private final Template template;
    private final License license;

    private Order(Builder builder) {
        this.id = builder.id;
        this.orderNumber = builder.orderNumber;
        this.tier = builder.tier;
        this.selectedFeatures = builder.selectedFeatures != null ? List.copyOf(builder.selectedFeatures) : List.of();
        this.customerName = builder.customerName;
        this.customerEmail = builder.customerEmail;
        this.total = builder.total != null ? builder.total : BigDecimal.ZERO;
        this.template = builder.template;
        this.license = builder.license;
    }

    public String getId() {
        return id;
    }

    public String getOrderNumber() {
        return orderNumber;
    }

    public String getTier() {
        return tier;
    }

    public List<String> getSelectedFeatures() {
        return selectedFeatures;
    }

    public Optional<String> getCustomerName() {
        return Optional.ofNullable(customerName);
    }

    public String getCustomerEmail() {
        return customerEmail;
    }

    /**
     * Name to print as licensee; falls back to the email when no name was given.
     */
    public String getLicensee() {
        return customerName != null && !customerName.isBlank() ? customerName : customerEmail;
    }

    public BigDecimal getTotal() {
        return total;
    }

    public Optional<Template> getTemplate() {
        return Optional.ofNullable(template);
    }

    public Optional<License> getLicense() {
        return Optional.ofNullable(license);
    }

    /**
     * Feature slugs bundled by the template, empty when the order has no template.
     */
    public List<String> getTemplateFeatures() {
        return template != null ? template.includedFeatures() : List.of();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Order order = (Order) o;
        return Objects.equals(id, order.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Order{" +
                "id='" + id + '\'' +
                ", orderNumber='" + orderNumber + '\'' +
                ", tier='" + tier + '\'' +
                ", selectedFeatures=" + selectedFeatures +
                ", template=" + (template != null ? template.slug() : null) +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private String orderNumber;
        private String tier;
        private List<String> selectedFeatures;
        private String customerName;
        private String customerEmail;
        private BigDecimal total;
        private Template template;
        private License license;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder orderNumber(String orderNumber) {
            this.orderNumber = orderNumber;
            return this;
        }

        public Builder tier(String tier) {
            this.tier = tier;
            return this;
        }

        public Builder selectedFeatures(List<String> selectedFeatures) {
            this.selectedFeatures = selectedFeatures;
            return this;
        }

        public Builder selectedFeatures(String... selectedFeatures) {
            this.selectedFeatures = List.of(selectedFeatures);
            return this;
        }

        public Builder customerName(String customerName) {
            this.customerName = customerName;
            return this;
        }

        public Builder customerEmail(String customerEmail) {
            this.customerEmail = customerEmail;
            return this;
        }

        public Builder total(BigDecimal total) {
            this.total = total;
            return this;
        }

        public Builder template(Template template) {
            this.template = template;
            return this;
        }

        public Builder license(License license) {
            this.license = license;
            return this;
        }

        public Order build() {
            Objects.requireNonNull(id, "id is required");
            Objects.requireNonNull(orderNumber, "orderNumber is required");
            Objects.requireNonNull(tier, "tier is required");
            Objects.requireNonNull(customerEmail, "customerEmail is required");
            if (tier.isBlank()) {
                throw new IllegalArgumentException("tier must not be blank");
            }
            return new Order(this);
        }
    }
}
