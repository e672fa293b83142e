package com.producthub.prefetch.controller;

import com.producthub.prefetch.dto.ApiResponse;
import com.producthub.prefetch.service.ProductDataService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 产品中心数据读取 API，查询参数作为 params 透传
 */
@RestController
@RequestMapping("/api/data")
@RequiredArgsConstructor
public class ProductDataController {
    
    private final ProductDataService productDataService;
    
    @GetMapping("/{category}/{identifier}")
    public ResponseEntity<ApiResponse<Object>> read(@PathVariable String category,
                                                    @PathVariable String identifier,
                                                    @RequestParam Map<String, String> query) {
        Object data = productDataService.read(category, identifier, new LinkedHashMap<String, Object>(query));
        if (data == null) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error(404, "数据不存在: " + category + ":" + identifier));
        }
        return ResponseEntity.ok(ApiResponse.success(data));
    }
}
