package com.myorg.normcontrol.rules.predicate;

import com.myorg.normcontrol.Fixtures;
import com.myorg.normcontrol.config.ComplianceProperties;
import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.rules.RuleContext;
import com.myorg.normcontrol.rules.RulePredicate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.assertj.core.api.Assertions.assertThat;

class RulePredicatesTest {

    private static final int MAX_TEXT = ComplianceProperties.DEFAULT_MAX_TEXT_LENGTH;

    private static RuleContext pageContext(String text) {
        return RuleContext.forPage(Fixtures.page(1, PageRole.MAIN_CONTENT, text), DocumentMetadata.empty(), MAX_TEXT);
    }

    private static RuleContext documentContext(List<Page> pages, ProjectInfo info) {
        DocumentMetadata metadata = DocumentMetadata.builder().projectInfo(info).build();
        return RuleContext.forDocument(pages, metadata, MAX_TEXT);
    }

    private static Pattern regex(String s) {
        return Pattern.compile(s, PatternLibrary.REGEX_FLAGS);
    }

    @Nested
    @DisplayName("keyword predicates")
    class Keywords {

        @Test
        @DisplayName("contains_any matches any keyword ignoring case")
        void containsAny() {
            RulePredicate p = new ContainsAnyPredicate(List.of("Масштаб", "1:"));

            assertThat(p.test(pageContext("МАСШТАБ указан"))).isTrue();
            assertThat(p.test(pageContext("М 1:100"))).isTrue();
            assertThat(p.test(pageContext("ничего"))).isFalse();
        }

        @Test
        @DisplayName("contains_all needs every keyword")
        void containsAll() {
            RulePredicate p = new ContainsAllPredicate(List.of("обозначение", "наименование"));

            assertThat(p.test(pageContext("Поз. Обозначение Наименование"))).isTrue();
            assertThat(p.test(pageContext("Поз. Обозначение"))).isFalse();
        }

        @Test
        @DisplayName("conditional holds when the trigger is absent")
        void conditional() {
            RulePredicate p = new ConditionalPredicate(
                    new ContainsAnyPredicate(List.of("арматур")),
                    new PatternMatchPredicate(regex("класс|(?<!\\p{L})[aа]\\d{3}")));

            assertThat(p.test(pageContext("Бетон B25"))).isTrue();
            assertThat(p.test(pageContext("Арматура А500С"))).isTrue();
            assertThat(p.test(pageContext("Арматура по расчету"))).isFalse();
        }

        @Test
        @DisplayName("any_of holds when one alternative holds")
        void anyOf() {
            RulePredicate p = new AnyOfPredicate(List.of(
                    new ContainsAnyPredicate(List.of("шифр")),
                    new ContainsAnyPredicate(List.of("обозначение"))));

            assertThat(p.test(pageContext("Обозначение документа"))).isTrue();
            assertThat(p.test(pageContext("Текст"))).isFalse();
        }

        @Test
        @DisplayName("min_length ignores surrounding whitespace")
        void minLength() {
            RulePredicate p = new MinLengthPredicate(10);

            assertThat(p.test(pageContext("   коротко   "))).isFalse();
            assertThat(p.test(pageContext("достаточно длинный текст"))).isTrue();
        }
    }

    @Nested
    @DisplayName("normative references")
    class References {

        private final RulePredicate gost = new WellFormedPredicate(
                regex("(?<!\\p{L})гост(?:\\s+р)?\\s+\\d[^\\s,;]*"),
                regex("гост(?:\\s+р)?\\s+\\d+(?:\\.\\d+)*-\\d{2,4}"));

        @Test
        @DisplayName("accepts references with number and year")
        void wellFormed() {
            assertThat(gost.test(pageContext("по ГОСТ Р 21.101-2020 и ГОСТ 5781-82"))).isTrue();
        }

        @Test
        @DisplayName("rejects a reference without year")
        void missingYear() {
            assertThat(gost.test(pageContext("по ГОСТ 21.501-2018 и ГОСТ 21.501"))).isFalse();
        }

        @Test
        @DisplayName("holds for text without references")
        void noCandidates() {
            assertThat(gost.test(pageContext("План этажа"))).isTrue();
        }
    }

    @Nested
    @DisplayName("stamp predicates")
    class Stamps {

        private RuleContext drawing(StampInfo stamp) {
            return RuleContext.forPage(Fixtures.drawing(3, "План", stamp), DocumentMetadata.empty(), MAX_TEXT);
        }

        @Test
        @DisplayName("stamp_present needs a detected stamp")
        void present() {
            assertThat(new StampPresentPredicate().test(drawing(Fixtures.stampWithSheet(1)))).isTrue();
            assertThat(new StampPresentPredicate().test(drawing(StampInfo.empty()))).isFalse();
            assertThat(new StampPresentPredicate().test(drawing(null))).isFalse();
        }

        @Test
        @DisplayName("stamp_field looks fields up by name")
        void field() {
            assertThat(new StampFieldPredicate(StampInfo.SCALE).test(drawing(Fixtures.stampWithSheet(1)))).isTrue();
            assertThat(new StampFieldPredicate(StampInfo.REVISION).test(drawing(Fixtures.stampWithSheet(1)))).isFalse();
            assertThat(new StampFieldPredicate(StampInfo.SCALE).test(drawing(null))).isFalse();
        }
    }

    @Nested
    @DisplayName("document predicates")
    class DocumentLevel {

        private List<Page> withSheets(Integer... sheets) {
            Page[] pages = new Page[sheets.length];
            for (int i = 0; i < sheets.length; i++) {
                StampInfo stamp = sheets[i] == null ? null : Fixtures.stampWithSheet(sheets[i]);
                pages[i] = Fixtures.drawing(i + 1, "План", stamp);
            }
            return List.of(pages);
        }

        @Test
        @DisplayName("sheet numbers must increase by one")
        void sheetNumbering() {
            SheetNumberingPredicate p = new SheetNumberingPredicate();

            assertThat(p.test(documentContext(withSheets(1, 2, 3), ProjectInfo.empty()))).isTrue();
            assertThat(p.test(documentContext(withSheets(3, null, 4), ProjectInfo.empty()))).isTrue();
            assertThat(p.test(documentContext(withSheets(1, 3), ProjectInfo.empty()))).isFalse();
            assertThat(p.test(documentContext(withSheets(2, 1), ProjectInfo.empty()))).isFalse();
            assertThat(p.test(documentContext(withSheets(5), ProjectInfo.empty()))).isTrue();
        }

        @Test
        @DisplayName("role_present scans every page")
        void rolePresent() {
            List<Page> pages = List.of(
                    Fixtures.page(1, PageRole.TITLE, ""),
                    Fixtures.page(2, PageRole.DRAWING, ""));

            assertThat(new RolePresentPredicate(PageRole.TITLE).test(documentContext(pages, ProjectInfo.empty()))).isTrue();
            assertThat(new RolePresentPredicate(PageRole.GENERAL_DATA).test(documentContext(pages, ProjectInfo.empty()))).isFalse();
        }

        @Test
        @DisplayName("project_field and project_field_format read the first page metadata")
        void projectFields() {
            ProjectInfo good = ProjectInfo.builder().projectCode("2024-01-15-КЖ").build();
            ProjectInfo bad = ProjectInfo.builder().projectCode("XYZ").build();
            ProjectFieldFormatPredicate format = new ProjectFieldFormatPredicate(
                    ProjectInfo.PROJECT_CODE, regex("^[\\p{L}\\d]+(?:[.\\-][\\p{L}\\d]+)*-(?:КЖ|АР)$"));

            assertThat(new ProjectFieldPredicate(ProjectInfo.PROJECT_CODE).test(documentContext(List.of(), good))).isTrue();
            assertThat(new ProjectFieldPredicate(ProjectInfo.STAGE).test(documentContext(List.of(), good))).isFalse();
            assertThat(format.test(documentContext(List.of(), good))).isTrue();
            assertThat(format.test(documentContext(List.of(), bad))).isFalse();
            // absence is reported by project_field, not by the format check
            assertThat(format.test(documentContext(List.of(), ProjectInfo.empty()))).isTrue();
        }
    }
}
