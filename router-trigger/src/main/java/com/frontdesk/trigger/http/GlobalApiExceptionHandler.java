package com.frontdesk.trigger.http;

import com.frontdesk.api.response.Response;
import com.frontdesk.types.enums.ResponseCode;
import com.frontdesk.types.exception.AppException;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.slf4j.MDC;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.BindException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * 统一 API 异常处理：所有失败都以 {@link Response} 信封返回，并输出一行 HTTP_ERROR 日志。
 */
@Slf4j
@RestControllerAdvice
public class GlobalApiExceptionHandler {

    static final int MAX_MESSAGE_LENGTH = 300;

    @ExceptionHandler(AppException.class)
    public Response<Object> handleAppException(AppException ex, HttpServletRequest request) {
        String code = StringUtils.defaultIfBlank(ex.getCode(), ResponseCode.UN_ERROR.getCode());
        String info = truncate(StringUtils.defaultIfBlank(ex.getInfo(), ResponseCode.UN_ERROR.getInfo()));
        log.warn(errorLine(), errorArgs(request, ex, code, info, ex.getCause()));
        return failure(code, info);
    }

    @ExceptionHandler({
            MethodArgumentNotValidException.class,
            BindException.class,
            MethodArgumentTypeMismatchException.class,
            MissingServletRequestParameterException.class,
            HttpMessageNotReadableException.class,
            IllegalArgumentException.class
    })
    public Response<Object> handleBadRequestException(Exception ex, HttpServletRequest request) {
        String info = truncate(StringUtils.defaultIfBlank(ex.getMessage(), ResponseCode.ILLEGAL_PARAMETER.getInfo()));
        log.warn(errorLine(), errorArgs(request, ex, ResponseCode.ILLEGAL_PARAMETER.getCode(), info, null));
        return failure(ResponseCode.ILLEGAL_PARAMETER.getCode(), info);
    }

    @ExceptionHandler(Exception.class)
    public Response<Object> handleUnknownException(Exception ex, HttpServletRequest request) {
        log.error(errorLine(), errorArgs(request, ex, ResponseCode.UN_ERROR.getCode(), truncate(ex.getMessage()), ex));
        return failure(ResponseCode.UN_ERROR.getCode(), ResponseCode.UN_ERROR.getInfo());
    }

    private Response<Object> failure(String code, String info) {
        return Response.<Object>builder()
                .code(code)
                .info(info)
                .build();
    }

    private String errorLine() {
        return "HTTP_ERROR path={}, method={}, traceId={}, requestId={}, errorType={}, errorCode={}, errorMessage={}";
    }

    private Object[] errorArgs(HttpServletRequest request, Exception ex, String code, String message, Throwable cause) {
        Object[] base = new Object[]{
                request == null ? "-" : StringUtils.defaultIfBlank(request.getRequestURI(), "-"),
                request == null ? "-" : StringUtils.defaultIfBlank(request.getMethod(), "-"),
                StringUtils.defaultIfBlank(MDC.get("traceId"), "-"),
                StringUtils.defaultIfBlank(MDC.get("requestId"), "-"),
                ex.getClass().getSimpleName(),
                code,
                message
        };
        if (cause == null) {
            return base;
        }
        Object[] withCause = new Object[base.length + 1];
        System.arraycopy(base, 0, withCause, 0, base.length);
        withCause[base.length] = cause;
        return withCause;
    }

    static String truncate(String text) {
        if (StringUtils.isBlank(text) || text.length() <= MAX_MESSAGE_LENGTH) {
            return text;
        }
        return text.substring(0, MAX_MESSAGE_LENGTH);
    }
}
