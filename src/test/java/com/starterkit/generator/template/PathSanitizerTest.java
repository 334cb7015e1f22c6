package com.starterkit.generator.template;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("PathSanitizer Tests")
class PathSanitizerTest {

    @TempDir
    Path root;

    @Nested
    @DisplayName("resolveWithin")
    class ResolveTests {

        @Test
        @DisplayName("Should resolve nested relative paths")
        void resolvesNested() {
            Path resolved = PathSanitizer.resolveWithin(root, "backend/src/../src/app.ts", "source");

            assertEquals(root.toAbsolutePath().normalize().resolve("backend/src/app.ts"), resolved);
        }

        @Test
        @DisplayName("Should reject traversal out of the root")
        void rejectsTraversal() {
            BaseTemplateException e = assertThrows(BaseTemplateException.class,
                    () -> PathSanitizer.resolveWithin(root, "../../etc/passwd", "source"));
            assertTrue(e.getMessage().contains("Path traversal detected in source"));
        }

        @Test
        @DisplayName("Should reject absolute paths")
        void rejectsAbsolute() {
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.resolveWithin(root, "/etc/passwd", "source"));
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.resolveWithin(root, "C:\\Windows", "source"));
        }

        @Test
        @DisplayName("Should reject blank, overlong and control-character paths")
        void rejectsMalformed() {
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.resolveWithin(root, " ", "source"));
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.resolveWithin(root, null, "source"));
            assertThrows(BaseTemplateException.class,
                    () -> PathSanitizer.resolveWithin(root, "a".repeat(PathSanitizer.MAX_PATH_LENGTH + 1), "source"));
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.resolveWithin(root, "a\u0000b", "source"));
        }
    }

    @Nested
    @DisplayName("normalizeEntryName")
    class EntryNameTests {

        @Test
        @DisplayName("Should use forward slashes and drop dot segments")
        void normalizes() {
            assertEquals("backend/src/app.ts", PathSanitizer.normalizeEntryName("./backend//src\\app.ts", "destination"));
        }

        @Test
        @DisplayName("Should reject parent references")
        void rejectsParent() {
            assertThrows(BaseTemplateException.class,
                    () -> PathSanitizer.normalizeEntryName("backend/../../x", "destination"));
        }

        @Test
        @DisplayName("Should reject destinations that name no file")
        void rejectsEmpty() {
            assertThrows(BaseTemplateException.class, () -> PathSanitizer.normalizeEntryName("./.", "destination"));
        }
    }
}
