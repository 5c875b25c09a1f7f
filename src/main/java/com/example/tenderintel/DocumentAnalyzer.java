package com.example.tenderintel;

import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;
import java.util.Set;

/**
 * Прогоняет все экстракторы по одному тексту и собирает {@link ExtractedDocument}.
 * Экстракторы независимы друг от друга и не бросают исключений на "плохом" тексте.
 */
@Slf4j
public class DocumentAnalyzer {
    private final MaterialExtractor materialExtractor;
    private final DeadlineExtractor deadlineExtractor;
    private final SpecificationExtractor specificationExtractor;
    private final ProjectInfoExtractor projectInfoExtractor;

    public DocumentAnalyzer(Clock clock) {
        this(new MaterialExtractor(),
                new DeadlineExtractor(clock),
                new SpecificationExtractor(),
                new ProjectInfoExtractor());
    }

    public DocumentAnalyzer(MaterialExtractor materialExtractor,
                            DeadlineExtractor deadlineExtractor,
                            SpecificationExtractor specificationExtractor,
                            ProjectInfoExtractor projectInfoExtractor) {
        this.materialExtractor = materialExtractor;
        this.deadlineExtractor = deadlineExtractor;
        this.specificationExtractor = specificationExtractor;
        this.projectInfoExtractor = projectInfoExtractor;
    }

    public ExtractedDocument analyze(String rawText) {
        String text = rawText != null ? rawText : "";

        Set<MaterialCategory> materials = materialExtractor.extract(text);
        LocalDate deadline = deadlineExtractor.extract(text);
        List<String> specifications = specificationExtractor.extract(text);
        ProjectInfo projectInfo = projectInfoExtractor.extract(text);

        log.info("Analyzed {} chars: {} materials, deadline {}, {} specifications, project '{}', reference '{}'",
                text.length(), materials.size(), deadline, specifications.size(),
                projectInfo.getProjectName(), projectInfo.getTenderReference());
        if (Config.getParserVerbose()) {
            log.debug("materials: {}", materials);
            log.debug("specifications: {}", specifications);
        }

        return ExtractedDocument.builder()
                .rawText(text)
                .materials(materials)
                .deadline(deadline)
                .specifications(specifications)
                .projectName(projectInfo.getProjectName())
                .tenderReference(projectInfo.getTenderReference())
                .build();
    }
}
