package com.kmmedia.institute.payments.web.dto;

import com.kmmedia.institute.payments.service.dto.BulkItemResult;
import java.util.List;

public record BulkStatusResponse(int succeeded, int failed, List<BulkItemResult> results) {

    public static BulkStatusResponse of(List<BulkItemResult> results) {
        int ok = (int) results.stream().filter(BulkItemResult::success).count();
        return new BulkStatusResponse(ok, results.size() - ok, results);
    }
}
