package com.lumen.query.resilience;

public interface PermanentFailure {
}
