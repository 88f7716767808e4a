package club.duocall.client.rtc;

/**
 * 当前选中的候选地址对的统计信息。
 *
 * @param localCandidateType  本地候选类型: host / srflx / prflx / relay。
 * @param remoteCandidateType 远端候选类型。
 * @param localAddress        本地地址，可能为空。
 * @param remoteAddress       远端地址，可能为空。
 */
public record CandidatePairStats(
        String localCandidateType,
        String remoteCandidateType,
        String localAddress,
        String remoteAddress) {

    public ConnectionRoute route() {
        return ConnectionRoute.classify(localCandidateType, remoteCandidateType);
    }

    /**
     * 隐去IP地址的后半部分，仅用于日志。
     * IPv4保留前两段 (`192.168.*.*`)，IPv6保留前两组。
     */
    public static String maskAddress(String address) {
        if (address == null || address.isBlank()) {
            return "unknown";
        }
        if (address.contains(".")) {
            var parts = address.split("\\.");
            if (parts.length >= 2) {
                return parts[0] + "." + parts[1] + ".*.*";
            }
        }
        if (address.contains(":")) {
            var parts = address.split(":");
            if (parts.length >= 2) {
                return parts[0] + ":" + parts[1] + ":****:****";
            }
        }
        return address;
    }
}
