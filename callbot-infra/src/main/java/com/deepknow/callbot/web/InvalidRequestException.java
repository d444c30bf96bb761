package com.deepknow.callbot.web;

import com.deepknow.callbot.domain.common.CallbotException;

/**
 * 请求参数不合法，映射为 400。
 */
public class InvalidRequestException extends CallbotException {
    public InvalidRequestException(String message) {
        super(message);
    }
}
