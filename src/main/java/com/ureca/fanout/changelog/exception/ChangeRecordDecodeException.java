package com.ureca.fanout.changelog.exception;

import com.ureca.fanout.common.BaseCode;
import com.ureca.fanout.common.exception.InternalServerException;

import static com.ureca.fanout.common.BaseCode.CHANGE_RECORD_DECODE_FAILED;

/**
 * 변경 레코드 해석 실패
 * 호출자가 잡아서 해당 레코드를 건너뛴다 (재전달 유발 금지)
 */
public class ChangeRecordDecodeException extends InternalServerException {

    public ChangeRecordDecodeException(String message) {
        super(CHANGE_RECORD_DECODE_FAILED, message);
    }

    public ChangeRecordDecodeException(BaseCode baseCode, String message) {
        super(baseCode, message);
    }

    public ChangeRecordDecodeException(String message, Throwable cause) {
        super(CHANGE_RECORD_DECODE_FAILED, message, cause);
    }
}
