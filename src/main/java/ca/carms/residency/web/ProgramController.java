package ca.carms.residency.web;

import ca.carms.residency.api.DisciplineSummary;
import ca.carms.residency.api.ProgramDetail;
import ca.carms.residency.api.ProgramSummary;
import ca.carms.residency.api.RankedSection;
import ca.carms.residency.service.ProgramQueryService;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read-only HTTP surface over the loaded program data.
 */
@RestController
@RequiredArgsConstructor
public class ProgramController {

    private final ProgramQueryService queryService;

    @GetMapping("/health")
    public Map<String, String> health() {
        return Map.of("status", "ok");
    }

    @GetMapping("/disciplines")
    public List<DisciplineSummary> listDisciplines() {
        return queryService.listDisciplines();
    }

    @GetMapping("/programs")
    public List<ProgramSummary> listPrograms(
            @RequestParam(name = "discipline_id", required = false) Integer disciplineId,
            @RequestParam(name = "school_id", required = false) Integer schoolId,
            @RequestParam(name = "q", required = false) String q,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {
        return queryService.listPrograms(disciplineId, schoolId, q, limit, offset);
    }

    @GetMapping("/programs/{programStreamId}")
    public ProgramDetail getProgram(@PathVariable("programStreamId") Integer programStreamId) {
        return queryService.getProgram(programStreamId);
    }

    @GetMapping("/search")
    public List<RankedSection> search(
            @RequestParam(name = "query", required = false) String query,
            @RequestParam(name = "limit", required = false) Integer limit,
            @RequestParam(name = "offset", required = false) Integer offset) {
        return queryService.search(query, limit, offset);
    }
}
