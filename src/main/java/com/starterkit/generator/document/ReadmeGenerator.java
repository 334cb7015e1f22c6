package com.starterkit.generator.document;

import com.starterkit.generator.core.model.Feature;
import com.starterkit.generator.core.model.Order;
import com.starterkit.generator.core.model.Template;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Getting-started README listing the included features by module category.
 */
public class ReadmeGenerator implements DocumentGenerator {

    public static final String DEFAULT_PATH = "README.md";
    static final String CUSTOM_CONFIGURATION = "Custom Configuration";

    private static final String QUICK_START = """
            ## Quick Start

            ### 1. Install Dependencies

            ```bash
            # Backend
            cd backend
            npm install

            # Web Frontend
            cd ../web
            npm install
            ```

            ### 2. Configure Environment

            Copy the example environment files and update with your values:

            ```bash
            cp backend/.env.example backend/.env
            cp web/.env.example web/.env.local
            ```

            ### 3. Set Up Database

            ```bash
            cd backend
            npm run db:migrate
            npm run db:seed
            ```

            ### 4. Start Development

            ```bash
            # In separate terminals:
            cd backend && npm run dev
            cd web && npm run dev
            ```
            """;

    private static final String PROJECT_STRUCTURE = """
            ## Project Structure

            ```
            .
            ├── backend/             # API server
            │   ├── prisma/          # Database schema and migrations
            │   └── src/
            │       ├── config/      # Configuration
            │       ├── controllers/ # API handlers
            │       ├── middleware/  # HTTP middleware
            │       ├── routes/      # API routes
            │       ├── services/    # Business logic
            │       └── utils/       # Utilities
            ├── web/                 # Web frontend
            │   └── src/
            │       ├── app/         # Pages
            │       ├── components/  # UI components
            │       └── lib/         # Utilities and hooks
            └── docs/                # Documentation
            ```
            """;

    private final String path;

    public ReadmeGenerator() {
        this(DEFAULT_PATH);
    }

    public ReadmeGenerator(String path) {
        this.path = Objects.requireNonNull(path, "path is required");
    }

    @Override
    public String path() {
        return path;
    }

    @Override
    public GeneratedDocument generate(DocumentContext context) {
        Order order = context.order();
        String title = order.getTemplate().map(Template::name).orElse(CUSTOM_CONFIGURATION);

        StringBuilder sb = new StringBuilder();
        sb.append("# ").append(title).append("\n\n");
        sb.append("## Package Information\n\n");
        sb.append("- **Tier:** ").append(context.tierDisplayName()).append('\n');
        sb.append("- **Template:** ").append(title).append('\n');
        sb.append("- **Order Number:** ").append(order.getOrderNumber()).append('\n');
        sb.append("- **Generated:** ").append(context.generatedAt()).append("\n\n");
        sb.append(QUICK_START).append('\n');

        sb.append("## Included Features\n");
        Map<String, List<Feature>> byCategory = groupByCategory(context.resolved().features());
        if (byCategory.isEmpty()) {
            sb.append("\nThis project contains the base template only.\n");
        }
        byCategory.forEach((category, features) -> {
            sb.append("\n### ").append(DocumentContext.capitalize(category)).append("\n\n");
            for (Feature feature : features) {
                sb.append("- **").append(feature.getName()).append("**");
                if (!feature.getDescription().isBlank()) {
                    sb.append(" - ").append(feature.getDescription());
                }
                sb.append('\n');
            }
        });
        sb.append('\n');

        sb.append(PROJECT_STRUCTURE).append('\n');
        sb.append("## Support\n\n");
        sb.append("For questions and support, contact us with your order number: ")
                .append(order.getOrderNumber()).append("\n\n");
        sb.append("## License\n\n");
        sb.append("See LICENSE.md for license terms.\n\n");
        sb.append("---\n\n");
        sb.append("Built with ").append(context.productName()).append('\n');

        return new GeneratedDocument(path, sb.toString());
    }

    // Categories keep the order in which they are first seen
    private static Map<String, List<Feature>> groupByCategory(List<Feature> features) {
        Map<String, List<Feature>> byCategory = new LinkedHashMap<>();
        for (Feature feature : features) {
            byCategory.computeIfAbsent(feature.getModule().category(), k -> new ArrayList<>()).add(feature);
        }
        return byCategory;
    }
}
