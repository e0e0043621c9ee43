package com.chooserich.client;

public class RandomNumberResponse {
    public boolean success;
    public Integer randomNumber;
}
