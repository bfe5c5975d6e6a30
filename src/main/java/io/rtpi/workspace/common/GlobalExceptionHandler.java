package io.rtpi.workspace.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.validation.BindingResult;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.NoHandlerFoundException;
import org.springframework.web.servlet.resource.NoResourceFoundException;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 领域异常 -> HTTP 状态码 + Result 包装：
 * QuotaExceeded=429, NotFound=404, Forbidden=403, 编排 API 不可用=502。
 */
@RestControllerAdvice
public class GlobalExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(MethodArgumentNotValidException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<?> handleValidationExceptions(MethodArgumentNotValidException ex) {
        BindingResult bindingResult = ex.getBindingResult();
        List<FieldError> fieldErrors = bindingResult.getFieldErrors();
        String message = fieldErrors.stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        return Result.error(400, message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<?> handleMissingParameter(MissingServletRequestParameterException e) {
        return Result.error(400, e.getParameterName() + " is required");
    }

    @ExceptionHandler(IllegalArgumentException.class)
    @ResponseStatus(HttpStatus.BAD_REQUEST)
    public Result<?> handleIllegalArgumentException(IllegalArgumentException e) {
        return Result.error(400, e.getMessage());
    }

    @ExceptionHandler(IllegalStateException.class)
    @ResponseStatus(HttpStatus.CONFLICT)
    public Result<?> handleIllegalStateException(IllegalStateException e) {
        return Result.error(409, e.getMessage());
    }

    @ExceptionHandler(QuotaExceededException.class)
    @ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
    public Result<?> handleQuotaExceeded(QuotaExceededException e) {
        return Result.error(429, e.getMessage());
    }

    @ExceptionHandler(WorkspaceNotFoundException.class)
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Result<?> handleWorkspaceNotFound(WorkspaceNotFoundException e) {
        return Result.error(404, e.getMessage());
    }

    @ExceptionHandler(WorkspaceForbiddenException.class)
    @ResponseStatus(HttpStatus.FORBIDDEN)
    public Result<?> handleForbidden(WorkspaceForbiddenException e) {
        return Result.error(403, e.getMessage());
    }

    @ExceptionHandler(OrchestrationUnavailableException.class)
    @ResponseStatus(HttpStatus.BAD_GATEWAY)
    public Result<?> handleOrchestrationUnavailable(OrchestrationUnavailableException e) {
        // 上游（容器编排 API）不可用/链路异常
        return Result.error(502, e.getMessage());
    }

    /**
     * 路由不存在/静态资源不存在：不要被兜底成 500。
     */
    @ExceptionHandler({NoResourceFoundException.class, NoHandlerFoundException.class})
    @ResponseStatus(HttpStatus.NOT_FOUND)
    public Result<?> handleNotFound(Exception e) {
        String msg = (e == null || e.getMessage() == null) ? "Not Found" : e.getMessage();
        return Result.error(404, msg);
    }

    @ExceptionHandler(Exception.class)
    @ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
    public Result<?> handleException(Exception e) {
        log.error("unhandled error: {}", e.getMessage(), e);
        return Result.error("系统错误：" + e.getMessage());
    }
}
