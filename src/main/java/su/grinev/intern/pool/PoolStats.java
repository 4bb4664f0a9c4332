package su.grinev.intern.pool;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class PoolStats {
    private final String name;
    private final int size;
    private final long hits;
    private final long misses;
    private final long evictions;
    private final long autoReleased;
}
