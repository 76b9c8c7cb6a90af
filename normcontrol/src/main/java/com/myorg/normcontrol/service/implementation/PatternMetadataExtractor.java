package com.myorg.normcontrol.service.implementation;

import com.myorg.normcontrol.model.DocumentMetadata;
import com.myorg.normcontrol.model.ProjectInfo;
import com.myorg.normcontrol.model.ProjectStage;
import com.myorg.normcontrol.model.StampInfo;
import com.myorg.normcontrol.patterns.MarkProfile;
import com.myorg.normcontrol.patterns.PatternLibrary;
import com.myorg.normcontrol.service.MetadataExtractor;
import com.myorg.normcontrol.service.processing.TextNormalizer;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex and keyword driven extraction of stamp fields and project information.
 * <p>
 * Input is truncated to {@code maxTextLength} before any pattern runs. A failure inside one
 * extraction is logged and yields an empty, zero-confidence result instead of an exception.
 */
@Slf4j
public class PatternMetadataExtractor implements MetadataExtractor {

    private static final int MAX_NAME_LENGTH = 300;
    private static final int MIN_ANCHOR_LINE_LENGTH = 10;
    private static final int MIN_UPPER_CASE_LINE_LENGTH = 15;
    private static final int MAX_CONTINUATION_LINES = 3;
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern TOKEN_EDGE_PUNCTUATION = Pattern.compile("^[\\p{Punct}«»“”]+|[\\p{Punct}«»“”]+$");

    private final int maxTextLength;

    public PatternMetadataExtractor(int maxTextLength) {
        this.maxTextLength = maxTextLength;
    }

    @Override
    public StampInfo extractStamp(String text, PatternLibrary library) {
        if (TextNormalizer.isBlank(text)) {
            return StampInfo.empty();
        }
        try {
            return readStamp(prepare(text), library);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Stamp extraction failed, continuing without stamp data: {}", e.toString());
            return StampInfo.empty();
        }
    }

    @Override
    public ProjectInfo extractProjectInfo(String text, PatternLibrary library) {
        if (TextNormalizer.isBlank(text)) {
            return ProjectInfo.empty();
        }
        try {
            return readProjectInfo(prepare(text), library);
        } catch (RuntimeException | StackOverflowError e) {
            log.warn("Project info extraction failed, continuing without project data: {}", e.toString());
            return ProjectInfo.empty();
        }
    }

    @Override
    public DocumentMetadata extractDocumentMetadata(String firstPageText, PatternLibrary library) {
        ProjectInfo projectInfo = extractProjectInfo(firstPageText, library);
        StampInfo stamp = extractStamp(firstPageText, library);
        List<String> norms = library.mark(projectInfo.getDocumentMark())
                .map(MarkProfile::getNormReferences)
                .orElse(List.of());
        log.debug("First page: code={}, mark={}, stage={}, confidence={}",
                projectInfo.getProjectCode(), projectInfo.getDocumentMark(),
                projectInfo.getStage(), projectInfo.getConfidence());
        return DocumentMetadata.builder()
                .projectInfo(projectInfo)
                .firstPageStamp(stamp)
                .applicableNorms(norms)
                .build();
    }

    // ===== Stamp =====

    private StampInfo readStamp(String text, PatternLibrary library) {
        StampInfo.StampInfoBuilder builder = StampInfo.builder();
        double confidence = 0.0;
        for (PatternLibrary.FieldPatterns field : library.stampFields()) {
            String value = firstGroup(field.patterns(), text);
            if (value != null && applyStampField(builder, field.field(), value)) {
                confidence += field.weight();
            }
        }
        boolean hasStamp = library.stampIndicators().stream().anyMatch(p -> p.matcher(text).find());
        return builder
                .hasStamp(hasStamp)
                .confidence(round2(Math.min(1.0, confidence)))
                .build();
    }

    private boolean applyStampField(StampInfo.StampInfoBuilder builder, String field, String raw) {
        String value = raw.trim();
        if (value.isEmpty()) {
            return false;
        }
        switch (field) {
            case StampInfo.SHEET_NUMBER: {
                Optional<Integer> number = parseInt(value, field);
                number.ifPresent(builder::sheetNumber);
                return number.isPresent();
            }
            case StampInfo.TOTAL_SHEETS: {
                Optional<Integer> number = parseInt(value, field);
                number.ifPresent(builder::totalSheets);
                return number.isPresent();
            }
            case StampInfo.REVISION: {
                Optional<Integer> number = parseInt(value, field);
                number.ifPresent(builder::revision);
                return number.isPresent();
            }
            case StampInfo.INVENTORY_NUMBER:
                builder.inventoryNumber(value);
                return true;
            case StampInfo.SCALE:
                builder.scale(WHITESPACE.matcher(value).replaceAll(""));
                return true;
            case StampInfo.PROJECT_CODE:
                builder.projectCode(value);
                return true;
            case StampInfo.OBJECT_NAME:
                builder.objectName(value);
                return true;
            case StampInfo.STAGE:
                builder.stage(value.toUpperCase(Locale.ROOT));
                return true;
            case StampInfo.DOCUMENT_SET:
                builder.documentSet(value.toUpperCase(Locale.ROOT));
                return true;
            default:
                log.debug("Pattern library defines unknown stamp field '{}', ignored", field);
                return false;
        }
    }

    // ===== Project info =====

    private ProjectInfo readProjectInfo(String text, PatternLibrary library) {
        List<String> lines = lines(text);
        String lower = TextNormalizer.lower(text);

        String code = findProjectCode(text, lines, library);
        String name = findProjectName(lines, library);
        ProjectStage stage = findStage(text, lower, library);
        Optional<MarkProfile> mark = findMark(code, lower, library);

        ProjectInfo info = ProjectInfo.builder()
                .projectCode(code)
                .projectName(name)
                .stage(stage)
                .documentMark(mark.map(MarkProfile::getCode).orElse(null))
                .documentSet(mark.map(MarkProfile::getName).orElse(null))
                .build();

        double confidence = 0.0;
        for (String field : List.of(ProjectInfo.PROJECT_CODE, ProjectInfo.PROJECT_NAME,
                ProjectInfo.STAGE, ProjectInfo.DOCUMENT_MARK)) {
            if (info.hasField(field)) {
                confidence += library.projectFieldWeight(field);
            }
        }
        return info.toBuilder().confidence(round2(Math.min(1.0, confidence))).build();
    }

    /**
     * Structured patterns first, then a token scan for code-shaped tokens: one that carries a
     * code hint, a digit and a hyphen.
     */
    private String findProjectCode(String text, List<String> lines, PatternLibrary library) {
        String structured = firstGroup(library.projectCodePatterns(), text);
        if (structured != null) {
            return structured;
        }
        List<String> hints = library.keywords(PatternLibrary.PROJECT_CODE_HINTS);
        for (String line : lines) {
            for (String rawToken : WHITESPACE.split(line)) {
                String token = TOKEN_EDGE_PUNCTUATION.matcher(rawToken).replaceAll("");
                String lowerToken = TextNormalizer.lower(token);
                if (token.indexOf('-') >= 0
                        && token.chars().anyMatch(Character::isDigit)
                        && hints.stream().anyMatch(lowerToken::contains)) {
                    return token;
                }
            }
        }
        return null;
    }

    private String findProjectName(List<String> lines, PatternLibrary library) {
        List<String> anchors = library.keywords(PatternLibrary.PROJECT_NAME_KEYWORDS);
        List<String> continuations = library.keywords(PatternLibrary.PROJECT_NAME_CONTINUATIONS);
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            String lower = TextNormalizer.lower(line);
            if (line.length() > MIN_ANCHOR_LINE_LENGTH && anchors.stream().anyMatch(lower::contains)) {
                StringBuilder name = new StringBuilder(line);
                for (int j = i + 1; j < lines.size() && j <= i + MAX_CONTINUATION_LINES; j++) {
                    String next = TextNormalizer.lower(lines.get(j));
                    if (continuations.stream().noneMatch(next::contains)) {
                        break;
                    }
                    name.append(' ').append(lines.get(j));
                }
                return clip(name.toString());
            }
        }

        List<String> labels = library.keywords(PatternLibrary.PROJECT_NAME_LABELS);
        for (int i = 0; i + 1 < lines.size(); i++) {
            String lower = TextNormalizer.lower(lines.get(i));
            if (labels.stream().anyMatch(lower::contains)) {
                return clip(lines.get(i + 1));
            }
        }

        for (String line : lines) {
            if (isUpperCaseHeading(line)) {
                return clip(line);
            }
        }
        return null;
    }

    private ProjectStage findStage(String text, String lower, PatternLibrary library) {
        for (ProjectStage stage : ProjectStage.values()) {
            if (library.stageKeywords(stage).stream().anyMatch(lower::contains)) {
                return stage;
            }
        }
        // fall back to the stage code of the title block
        return library.stampFields().stream()
                .filter(f -> StampInfo.STAGE.equals(f.field()))
                .map(f -> firstGroup(f.patterns(), text))
                .filter(Objects::nonNull)
                .map(library::stageForCode)
                .flatMap(Optional::stream)
                .findFirst()
                .orElse(null);
    }

    /**
     * The trailing segment of the project code names the mark; content keywords are the fallback.
     */
    private Optional<MarkProfile> findMark(String code, String lower, PatternLibrary library) {
        if (code != null) {
            int dash = code.lastIndexOf('-');
            String suffix = dash >= 0 ? code.substring(dash + 1) : code;
            Optional<MarkProfile> fromCode = library.mark(suffix);
            if (fromCode.isPresent()) {
                return fromCode;
            }
        }
        for (MarkProfile mark : library.marks()) {
            for (String keyword : mark.getKeywords()) {
                if (lower.contains(keyword.toLowerCase(Locale.ROOT))) {
                    return Optional.of(mark);
                }
            }
        }
        return Optional.empty();
    }

    // ===== Helpers =====

    private String prepare(String text) {
        return TextNormalizer.normalize(TextNormalizer.truncate(text, maxTextLength));
    }

    private static String firstGroup(List<Pattern> patterns, String text) {
        for (Pattern p : patterns) {
            Matcher m = p.matcher(text);
            if (m.find()) {
                String value = m.groupCount() >= 1 ? m.group(1) : m.group();
                if (value != null && !value.isBlank()) {
                    return value.trim();
                }
            }
        }
        return null;
    }

    private static Optional<Integer> parseInt(String value, String field) {
        try {
            return Optional.of(Integer.parseInt(value));
        } catch (NumberFormatException e) {
            log.debug("Unreadable {} '{}' in stamp", field, value);
            return Optional.empty();
        }
    }

    private static List<String> lines(String text) {
        List<String> lines = new ArrayList<>();
        for (String raw : LINE_BREAK.split(text)) {
            String line = raw.trim();
            if (!line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static boolean isUpperCaseHeading(String line) {
        if (line.length() < MIN_UPPER_CASE_LINE_LENGTH) {
            return false;
        }
        long letters = line.chars().filter(Character::isLetter).count();
        if (letters < MIN_UPPER_CASE_LINE_LENGTH / 2) {
            return false;
        }
        return line.chars().filter(Character::isLetter).noneMatch(Character::isLowerCase);
    }

    private static String clip(String name) {
        String trimmed = name.trim();
        return trimmed.length() <= MAX_NAME_LENGTH ? trimmed : trimmed.substring(0, MAX_NAME_LENGTH).trim();
    }

    private static double round2(double v) {
        return Math.round(v * 100.0) / 100.0;
    }
}
