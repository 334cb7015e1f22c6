package com.starterkit.generator.document;

import com.fasterxml.jackson.databind.JsonNode;
import com.starterkit.generator.TestFixtures;
import com.starterkit.generator.core.JsonSupport;
import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.License;
import com.starterkit.generator.core.model.LicenseStatus;
import com.starterkit.generator.core.model.Order;
import com.starterkit.generator.core.model.Template;
import com.starterkit.generator.merge.ArtifactMerger;
import com.starterkit.generator.merge.EnvMerger;
import com.starterkit.generator.merge.MergedArtifacts;
import com.starterkit.generator.merge.VersionConflictStrategy;
import com.starterkit.generator.resolve.ResolvedFeatureSet;
import com.starterkit.generator.template.BaseTemplate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@DisplayName("Document Generator Tests")
class DocumentGeneratorTest {

    private static final Instant GENERATED_AT = Instant.parse("2024-03-15T10:30:00Z");

    private BaseTemplate template;

    @BeforeEach
    void setUp() {
        template = mock(BaseTemplate.class);
        when(template.readFile("backend/package.json")).thenReturn(Optional.of(TestFixtures.BASE_MANIFEST));
        when(template.readFile("backend/prisma/schema.prisma")).thenReturn(Optional.of(TestFixtures.BASE_SCHEMA));
        when(template.readSource(anyString())).thenReturn(Optional.empty());
    }

    private DocumentContext context(Order order, List<Feature> features) {
        ResolvedFeatureSet resolved = new ResolvedFeatureSet(features,
                features.stream().map(Feature::getSlug).toList(), Map.of(), List.of());
        MergedArtifacts merged = new ArtifactMerger(template, "backend/package.json",
                "backend/prisma/schema.prisma", EnvMerger.CORE_VARIABLES, VersionConflictStrategy.LAST_WINS)
                .merge("starter-pro", resolved);
        return new DocumentContext(order, resolved, merged, "starter-pro", "Starter Kit", GENERATED_AT);
    }

    private static Order licensedOrder() {
        return Order.builder()
                .id("order-2")
                .orderNumber("ORD-2024-0002")
                .tier("enterprise")
                .customerName("Sam Lee")
                .customerEmail("sam@example.com")
                .template(new Template("SaaS Starter", "saas-starter", List.of("auth.basic")))
                .license(new License("LIC-ABCD-1234", "token", 0, 5, LicenseStatus.ACTIVE, null))
                .build();
    }

    @Nested
    @DisplayName("LicenseGenerator")
    class LicenseTests {

        @Test
        @DisplayName("Orders without a license render N/A fields")
        void withoutLicense() {
            GeneratedDocument doc = new LicenseGenerator().generate(context(TestFixtures.order("pro"), List.of()));

            assertEquals("LICENSE.md", doc.path());
            assertTrue(doc.content().startsWith("# Starter Kit License\n"));
            assertTrue(doc.content().contains("- **License Key:** N/A"));
            assertTrue(doc.content().contains("- **Expires:** N/A"));
            assertTrue(doc.content().contains("- **Status:** N/A"));
            assertTrue(doc.content().contains("- **Licensed To:** Dana Buyer"));
            assertTrue(doc.content().contains("- **Tier:** Pro"));
            assertTrue(doc.content().contains("- **Issue Date:** 2024-03-15"));
        }

        @Test
        @DisplayName("Lifetime licenses never expire")
        void lifetimeLicense() {
            GeneratedDocument doc = new LicenseGenerator().generate(context(licensedOrder(), List.of()));

            assertTrue(doc.content().contains("- **License Key:** LIC-ABCD-1234"));
            assertTrue(doc.content().contains("- **Expires:** Never"));
            assertTrue(doc.content().contains("- **Status:** ACTIVE"));
        }

        @Test
        @DisplayName("Licensee falls back to the email")
        void licenseeFallback() {
            Order order = Order.builder().id("o").orderNumber("ORD-9").tier("starter")
                    .customerEmail("anon@example.com").build();

            GeneratedDocument doc = new LicenseGenerator().generate(context(order, List.of()));

            assertTrue(doc.content().contains("- **Licensed To:** anon@example.com"));
        }
    }

    @Nested
    @DisplayName("ReadmeGenerator")
    class ReadmeTests {

        @Test
        @DisplayName("Orders without a template use the custom configuration title")
        void customConfiguration() {
            GeneratedDocument doc = new ReadmeGenerator().generate(context(TestFixtures.order("pro"), List.of()));

            assertTrue(doc.content().startsWith("# Custom Configuration\n"));
            assertTrue(doc.content().contains("This project contains the base template only."));
            assertTrue(doc.content().contains("contact us with your order number: ORD-2024-0001"));
            assertTrue(doc.content().endsWith("Built with Starter Kit\n"));
        }

        @Test
        @DisplayName("Features are grouped by module category in first-seen order")
        void groupedByCategory() {
            GeneratedDocument doc = new ReadmeGenerator().generate(context(licensedOrder(),
                    List.of(TestFixtures.authBasic(), TestFixtures.stripe(), TestFixtures.googleAuth())));

            String content = doc.content();
            assertTrue(content.startsWith("# SaaS Starter\n"));
            int auth = content.indexOf("### Authentication");
            int monetization = content.indexOf("### Monetization");
            assertTrue(auth > 0 && monetization > auth);
            assertTrue(content.indexOf("- **Google Sign-In** - OAuth login with Google") < monetization);
            assertTrue(content.contains("- **Stripe Payments** - Checkout and webhooks"));
        }
    }

    @Nested
    @DisplayName("DescriptorGenerator")
    class DescriptorTests {

        @Test
        @DisplayName("Should describe tier, features and license")
        void descriptor() throws Exception {
            GeneratedDocument doc = new DescriptorGenerator().generate(context(licensedOrder(),
                    List.of(TestFixtures.authBasic(), TestFixtures.stripe())));

            JsonNode json = JsonSupport.mapper().readTree(doc.content());
            assertEquals("enterprise", json.get("tier").asText());
            assertEquals("saas-starter", json.get("template").asText());
            assertEquals(2, json.get("features").size());
            assertEquals("payments.stripe", json.get("features").get(1).asText());
            assertEquals("LIC-ABCD-1234", json.get("license").get("key").asText());
            assertEquals("ORD-2024-0002", json.get("license").get("orderNumber").asText());
            assertEquals("2024-03-15T10:30:00Z", json.get("generatedAt").asText());
        }

        @Test
        @DisplayName("Missing template and license are null")
        void nulls() throws Exception {
            GeneratedDocument doc = new DescriptorGenerator().generate(context(TestFixtures.order("pro"), List.of()));

            JsonNode json = JsonSupport.mapper().readTree(doc.content());
            assertTrue(json.get("template").isNull());
            assertTrue(json.get("license").get("key").isNull());
            assertTrue(doc.content().endsWith("}\n"));
        }
    }

    @Nested
    @DisplayName("EnvTemplateGenerator")
    class EnvTemplateTests {

        @Test
        @DisplayName("Core variables are grouped by heading")
        void coreSection() {
            GeneratedDocument doc = new EnvTemplateGenerator().generate(context(TestFixtures.order("pro"), List.of()));

            String content = doc.content();
            assertEquals("backend/.env.example", doc.path());
            assertTrue(content.startsWith("# Environment Variables\n# Generated by Starter Kit\n"));
            assertTrue(content.contains("# Server\nNODE_ENV=development\nPORT=8000\n"));
            assertTrue(content.contains("# JWT\nJWT_SECRET="));
            assertFalse(content.contains("# Feature Configuration"));
        }

        @Test
        @DisplayName("Feature variables are listed under their feature with required markers")
        void featureSection() {
            GeneratedDocument doc = new EnvTemplateGenerator().generate(context(TestFixtures.order("pro"),
                    List.of(TestFixtures.s3Upload())));

            String content = doc.content();
            assertTrue(content.contains("# Feature Configuration"));
            assertTrue(content.contains(
                    "# S3 Uploads\n# AWS region\nAWS_REGION=us-east-1\n# Bucket name (required)\nS3_BUCKET=\n"));
        }
    }
}
