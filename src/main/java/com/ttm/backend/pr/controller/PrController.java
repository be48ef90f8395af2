package com.ttm.backend.pr.controller;

import com.ttm.backend.pr.dto.*;
import com.ttm.backend.pr.service.PrParsingService;
import jakarta.validation.Valid;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/prs")
public class PrController {

    private final PrParsingService svc;

    public PrController(PrParsingService svc) {
        this.svc = svc;
    }

    /** 單行 PR 解析；解析不到回 not_found（200，不是錯誤） */
    @PostMapping("/parse")
    public ParsePrResponse parse(@Valid @RequestBody ParsePrRequest req) {
        return svc.parse(req.message(), req.userId(), req.programExercises())
                .map(PrDto::from)
                .map(ParsePrResponse::ok)
                .orElseGet(ParsePrResponse::notFound);
    }

    /** 多行訊息：逐行解析 */
    @PostMapping("/parse-all")
    public ParseAllResponse parseAll(@Valid @RequestBody ParsePrRequest req) {
        List<PrDto> prs = svc.parseAll(req.message(), req.userId(), req.programExercises())
                .stream()
                .map(PrDto::from)
                .toList();
        return new ParseAllResponse(prs.size(), prs);
    }

    @PostMapping("/normalize")
    public NormalizeResponse normalize(@Valid @RequestBody NormalizeRequest req) {
        return new NormalizeResponse(req.name(), svc.normalize(req.name(), req.weight()));
    }
}
