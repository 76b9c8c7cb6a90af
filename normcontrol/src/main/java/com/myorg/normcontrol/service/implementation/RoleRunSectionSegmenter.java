package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.exception.InternalPipelineException;
import com.myorg.normcontrol.model.Page;
import com.myorg.normcontrol.model.PageRole;
import com.myorg.normcontrol.model.Section;
import com.myorg.normcontrol.service.SectionSegmenter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Opens a new section whenever the page role changes. The resulting partition is verified
 * before it is returned; a broken partition is a pipeline bug and is never patched up.
 */
@Slf4j
@Service
public class RoleRunSectionSegmenter implements SectionSegmenter {

    @Override
    public List<Section> segment(List<Page> pages) {
        List<Section> sections = new ArrayList<>();
        PageRole currentRole = null;
        int start = 0;
        int end = 0;

        for (Page page : pages) {
            if (!page.isClassified()) {
                throw new InternalPipelineException("Page " + page.getPageNumber() + " reached segmentation unclassified");
            }
            PageRole role = page.getClassifiedRole();
            if (currentRole != null && role == currentRole) {
                end = page.getPageNumber();
                continue;
            }
            if (currentRole != null) {
                sections.add(section(currentRole, start, end));
            }
            currentRole = role;
            start = page.getPageNumber();
            end = page.getPageNumber();
        }
        if (currentRole != null) {
            sections.add(section(currentRole, start, end));
        }

        verifyPartition(sections, pages.size());
        log.debug("Segmented {} pages into {} sections", pages.size(), sections.size());
        return List.copyOf(sections);
    }

    /**
     * Sections must be sorted, contiguous, non-empty, start at page 1 and end at the last page.
     */
    static void verifyPartition(List<Section> sections, int totalPages) {
        if (totalPages == 0) {
            if (!sections.isEmpty()) {
                throw new InternalPipelineException("Sections produced for an empty document");
            }
            return;
        }
        if (sections.isEmpty()) {
            throw new InternalPipelineException("No sections for a " + totalPages + "-page document");
        }
        int expectedStart = 1;
        for (Section s : sections) {
            if (s.getStartPage() > s.getEndPage()) {
                throw new InternalPipelineException("Section " + s.getSectionType().getValue()
                        + " ends before it starts: " + s.getStartPage() + ".." + s.getEndPage());
            }
            if (s.getStartPage() != expectedStart) {
                throw new InternalPipelineException("Section " + s.getSectionType().getValue() + " starts at page "
                        + s.getStartPage() + ", expected " + expectedStart);
            }
            expectedStart = s.getEndPage() + 1;
        }
        if (expectedStart - 1 != totalPages) {
            throw new InternalPipelineException("Sections end at page " + (expectedStart - 1)
                    + " but the document has " + totalPages + " pages");
        }
    }

    private static Section section(PageRole role, int start, int end) {
        return Section.builder().sectionType(role).startPage(start).endPage(end).build();
    }
}
