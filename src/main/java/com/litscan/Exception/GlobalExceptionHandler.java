package com.litscan.Exception;

import com.litscan.model.vo.ErrorVO;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.BindException;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import top.continew.starter.core.exception.BusinessException;

import java.util.stream.Collectors;

/**
 * 全局异常处理器
 *
 * @author litscan
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * 业务异常
     */
    @ExceptionHandler(BusinessException.class)
    public ResponseEntity<ErrorVO> handleBusinessException(BusinessException e) {
        log.warn("业务异常: {}", e.getMessage());
        return error(HttpStatus.BAD_REQUEST, e.getMessage());
    }

    /**
     * 参数绑定 / 校验异常（MethodArgumentNotValidException 是其子类）
     */
    @ExceptionHandler(BindException.class)
    public ResponseEntity<ErrorVO> handleBindException(BindException e) {
        String message = e.getBindingResult()
                .getFieldErrors()
                .stream()
                .map(FieldError::getDefaultMessage)
                .collect(Collectors.joining(", "));
        log.warn("参数校验异常: {}", message);
        return error(HttpStatus.BAD_REQUEST, message);
    }

    @ExceptionHandler(MissingServletRequestParameterException.class)
    public ResponseEntity<ErrorVO> handleMissingParameter(MissingServletRequestParameterException e) {
        log.warn("缺少请求参数: {}", e.getParameterName());
        return error(HttpStatus.BAD_REQUEST, "缺少请求参数: " + e.getParameterName());
    }

    /**
     * 其他未捕获的异常
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorVO> handleException(Exception e) {
        log.error("系统异常: {}", e.getMessage(), e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "系统异常,请稍后重试");
    }

    private static ResponseEntity<ErrorVO> error(HttpStatus status, String message) {
        return ResponseEntity.status(status).body(new ErrorVO(status.value(), message));
    }
}
