package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.Fixtures;
import com.myorg.normcontrol.exception.InternalPipelineException;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.PageText;
import com.myorg.normcontrol.model.Section;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class RoleRunSectionSegmenterTest {

    private final RoleRunSectionSegmenter segmenter = new RoleRunSectionSegmenter();

    private static List<Page> pages(PageRole... roles) {
        List<Page> pages = new ArrayList<>();
        for (int i = 0; i < roles.length; i++) {
            pages.add(Fixtures.page(i + 1, roles[i], "text"));
        }
        return pages;
    }

    private static Section section(PageRole role, int start, int end) {
        return Section.builder().sectionType(role).startPage(start).endPage(end).build();
    }

    @Nested
    @DisplayName("segment()")
    class Segment {

        @Test
        @DisplayName("opens a section at every role change")
        void roleRuns() {
            List<Section> sections = segmenter.segment(pages(
                    PageRole.TITLE, PageRole.GENERAL_DATA, PageRole.DRAWING, PageRole.DRAWING,
                    PageRole.SPECIFICATION, PageRole.DRAWING));

            assertThat(sections)
                    .extracting(Section::getSectionType, Section::getStartPage, Section::getEndPage)
                    .containsExactly(
                            tuple(PageRole.TITLE, 1, 1),
                            tuple(PageRole.GENERAL_DATA, 2, 2),
                            tuple(PageRole.DRAWING, 3, 4),
                            tuple(PageRole.SPECIFICATION, 5, 5),
                            tuple(PageRole.DRAWING, 6, 6));
            assertThat(sections.get(2).getPagesCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("partitions the document: every page in exactly one section")
        void partition() {
            List<Page> doc = pages(PageRole.MAIN_CONTENT, PageRole.MAIN_CONTENT, PageRole.UNKNOWN,
                    PageRole.DETAILS, PageRole.DETAILS, PageRole.DETAILS, PageRole.MAIN_CONTENT);

            List<Section> sections = segmenter.segment(doc);

            for (Page page : doc) {
                assertThat(sections.stream().filter(s -> s.contains(page.getPageNumber())))
                        .singleElement()
                        .extracting(Section::getSectionType)
                        .isEqualTo(page.getClassifiedRole());
            }
            assertThat(sections.stream().mapToInt(Section::getPagesCount).sum()).isEqualTo(doc.size());
        }

        @Test
        @DisplayName("an empty document has no sections")
        void empty() {
            assertThat(segmenter.segment(List.of())).isEmpty();
        }

        @Test
        @DisplayName("an unclassified page is a pipeline error")
        void unclassified() {
            List<Page> doc = List.of(Page.of(PageText.of(1, "text")));

            assertThatThrownBy(() -> segmenter.segment(doc))
                    .isInstanceOf(InternalPipelineException.class)
                    .hasMessageContaining("unclassified");
        }
    }

    @Nested
    @DisplayName("verifyPartition()")
    class VerifyPartition {

        @Test
        @DisplayName("rejects a section that ends before it starts")
        void inverted() {
            assertThatThrownBy(() -> RoleRunSectionSegmenter.verifyPartition(
                    List.of(section(PageRole.TITLE, 2, 1)), 2))
                    .isInstanceOf(InternalPipelineException.class)
                    .hasMessageContaining("ends before it starts");
        }

        @Test
        @DisplayName("rejects a gap between sections")
        void gap() {
            assertThatThrownBy(() -> RoleRunSectionSegmenter.verifyPartition(
                    List.of(section(PageRole.TITLE, 1, 1), section(PageRole.DRAWING, 3, 3)), 3))
                    .isInstanceOf(InternalPipelineException.class);
        }

        @Test
        @DisplayName("rejects sections that stop short of the last page")
        void shortCoverage() {
            assertThatThrownBy(() -> RoleRunSectionSegmenter.verifyPartition(
                    List.of(section(PageRole.TITLE, 1, 2)), 3))
                    .isInstanceOf(InternalPipelineException.class)
                    .hasMessageContaining("3 pages");
        }

        @Test
        @DisplayName("rejects a missing partition for a non-empty document")
        void noSections() {
            assertThatThrownBy(() -> RoleRunSectionSegmenter.verifyPartition(List.of(), 1))
                    .isInstanceOf(InternalPipelineException.class);
        }
    }
}
