package com.hrkey.rvl.controller;

import com.hrkey.rvl.dto.PublicReferenceView;
import com.hrkey.rvl.dto.ReferenceSubmission;
import com.hrkey.rvl.dto.RvlInfo;
import com.hrkey.rvl.dto.ValidatedReferenceRecord;
import com.hrkey.rvl.dto.ValidationOptions;
import com.hrkey.rvl.service.ReferenceValidationOrchestrator;
import com.hrkey.rvl.service.StructuredOutputGenerator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.*;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.*;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/v1/rvl")
@RequiredArgsConstructor
public class RvlController {

    private final ReferenceValidationOrchestrator orchestrator;
    private final StructuredOutputGenerator outputGenerator;

    @Operation(summary = "RVL 상태 조회", description = "버전, 활성 기능, 임계값, 임베딩 provider 상태를 반환합니다.")
    @GetMapping("/info")
    public ResponseEntity<RvlInfo> info() {
        return ResponseEntity.ok(orchestrator.getInfo());
    }

    @Operation(summary = "추천서 검증 미리보기",
            description = "임베딩 없이 검증 파이프라인을 실행하고 공개 API 형태로 반환합니다. 결과는 저장하지 않습니다.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "검증 완료 (상태는 본문 status 참고)"),
            @ApiResponse(responseCode = "400", description = "요청 형식 오류"),
            @ApiResponse(responseCode = "422", description = "본문이 너무 짧음 (TEXT_TOO_SHORT)"),
            @ApiResponse(responseCode = "500", description = "서버 오류")
    })
    @PostMapping("/preview")
    public ResponseEntity<PublicReferenceView> preview(
            @Valid @RequestBody ReferenceSubmission submission,
            @RequestParam(defaultValue = "false") boolean includeInternal) {
        ValidationOptions options = ValidationOptions.builder()
                .skipEmbeddings(true)
                .build();
        ValidatedReferenceRecord record = orchestrator.validateReference(submission, options);
        return ResponseEntity.ok(outputGenerator.forPublicApi(record, includeInternal));
    }
}
