package com.example.pointledger.service.model;

import com.example.pointledger.entity.TransferRequest;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * 冪等登記結果
 *
 * replayed = true 表示同一 key 與相同內容的重送，request 為既有請求
 */
@Getter
@AllArgsConstructor
public class Registration {

    private final TransferRequest request;

    private final boolean replayed;

    public static Registration created(TransferRequest request) {
        return new Registration(request, false);
    }

    public static Registration replayed(TransferRequest request) {
        return new Registration(request, true);
    }
}
