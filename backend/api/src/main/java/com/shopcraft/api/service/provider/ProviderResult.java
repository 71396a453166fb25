package com.shopcraft.api.service.provider;

import java.util.Objects;

/**
 * 프로바이더 호출 결과
 * 성공 값 또는 실패 원인(kind + detail) 중 하나만 가짐
 * 파이프라인은 isSuccess() 로만 분기하고, 원인은 로그로만 남김
 */
public final class ProviderResult<T> {

    private final T value;
    private final FailureKind failureKind;
    private final String detail;

    private ProviderResult(T value, FailureKind failureKind, String detail) {
        this.value = value;
        this.failureKind = failureKind;
        this.detail = detail;
    }

    public static <T> ProviderResult<T> success(T value) {
        return new ProviderResult<>(Objects.requireNonNull(value, "value"), null, null);
    }

    public static <T> ProviderResult<T> failure(FailureKind kind, String detail) {
        return new ProviderResult<>(null, Objects.requireNonNull(kind, "kind"), detail);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    /**
     * @throws IllegalStateException 실패 결과인 경우
     */
    public T getValue() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed result: " + failureKind);
        }
        return value;
    }

    public FailureKind getFailureKind() {
        return failureKind;
    }

    public String getDetail() {
        return detail;
    }

    /**
     * 실패 결과를 다른 값 타입으로 전달
     */
    public <U> ProviderResult<U> propagateFailure() {
        if (isSuccess()) {
            throw new IllegalStateException("Cannot propagate a successful result");
        }
        return new ProviderResult<>(null, failureKind, detail);
    }

    @Override
    public String toString() {
        return isSuccess() ? "ProviderResult[success]" : "ProviderResult[" + failureKind + ": " + detail + "]";
    }
}
