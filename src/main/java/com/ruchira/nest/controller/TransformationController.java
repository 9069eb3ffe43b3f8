package com.ruchira.nest.controller;

import com.ruchira.nest.dto.TransformationRequestDto;
import com.ruchira.nest.service.NestingTransformationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

import static com.ruchira.nest.constant.Constants.TRANSFORMATION_PATH;

@RestController
@RequestMapping("/")
@RequiredArgsConstructor
@Slf4j
public class TransformationController {

    private final NestingTransformationService nestingTransformationService;

    /**
     * Transform flat dicts to dict of dicts.
     * Errors are mapped to responses by {@link com.ruchira.nest.exception.GlobalExceptionHandler}.
     */
    @PutMapping(TRANSFORMATION_PATH)
    public ResponseEntity<Map<Object, Object>> putTransformation(@Valid @RequestBody TransformationRequestDto request) {
        log.info("Transformation requested: {} records, nesting levels {}, recursive={}",
                request.getFlatDicts().size(), request.getNestingLevels(), request.isUseRecursiveRealization());

        Map<Object, Object> transformed = nestingTransformationService.transform(
                request.getNestingLevels(),
                request.getFlatDicts(),
                request.isUseRecursiveRealization()
        );
        return ResponseEntity.ok(transformed);
    }
}
