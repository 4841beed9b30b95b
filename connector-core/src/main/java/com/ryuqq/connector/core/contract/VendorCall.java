package com.ryuqq.connector.core.contract;

import com.ryuqq.connector.core.outcome.VendorOutcome;

import java.io.IOException;

/**
 * 보호 체인 안에서 실행되는 단일 vendor 호출.
 *
 * <p>응답은 HTTP 경계에서 한 번만 디코딩하여 {@link VendorOutcome}으로 분류해 돌려줍니다.
 * 401을 예외로 던지지 않고 {@code NeedsRefresh}로 반환해야 갱신 후 재시도가 동작합니다.</p>
 *
 * <pre>{@code
 * VendorCall<List<Issue>> listIssues = token -> {
 *     HttpResponse<String> res = http.send(request(token), BodyHandlers.ofString());
 *     return HttpOutcomes.fromStatus(res.statusCode(),
 *         res.headers().firstValue("Retry-After").orElse(null),
 *         () -> decode(res.body()), clock);
 * };
 * }</pre>
 *
 * @param <T> 디코딩된 값 타입
 * @author Connector Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface VendorCall<T> {

    /**
     * vendor 호출 실행.
     *
     * @param accessToken 복호화된 Access Token (인증 없는 호출이면 null)
     * @return 분류된 결과
     * @throws IOException 네트워크 오류 (NETWORK 실패로 분류됨)
     */
    VendorOutcome<T> call(String accessToken) throws IOException;
}
