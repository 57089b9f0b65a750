package com.dispatch.listener;

public enum ExchangeType
{
    Direct
    ;

    @Override
    public String toString()
    {
        return name().toLowerCase();
    }
}
