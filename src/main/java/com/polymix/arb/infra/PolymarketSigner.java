package com.polymix.arb.infra;

import lombok.Builder;
import lombok.Data;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.Hash;
import org.web3j.crypto.Sign;
import org.web3j.utils.Numeric;

import java.math.BigInteger;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * EIP-712 signatures for the Polymarket CLOB: the {@code ClobAuth} wallet attestation used
 * to obtain API credentials, and exchange {@code Order}s.
 */
public class PolymarketSigner {

    // CTF Exchange on Polygon
    static final String EXCHANGE_ADDRESS = "0x4bFb41d5B3570DeFd03C39a9A4D8dE6Bd8B8982E";

    static final String CLOB_AUTH_MESSAGE = "This message attests that I control the given wallet";

    private static final byte[] ORDER_DOMAIN_TYPEHASH = Hash.sha3(
            "EIP712Domain(string name,string version,uint256 chainId,address verifyingContract)"
                    .getBytes(StandardCharsets.UTF_8));

    private static final byte[] AUTH_DOMAIN_TYPEHASH = Hash.sha3(
            "EIP712Domain(string name,string version,uint256 chainId)".getBytes(StandardCharsets.UTF_8));

    private static final byte[] ORDER_TYPEHASH = Hash.sha3(
            "Order(uint256 salt,address maker,address signer,address taker,uint256 tokenId,uint256 makerAmount,uint256 takerAmount,uint256 expiration,uint256 nonce,uint256 feeRateBps,uint8 side,uint8 signatureType)"
                    .getBytes(StandardCharsets.UTF_8));

    private static final byte[] CLOB_AUTH_TYPEHASH = Hash.sha3(
            "ClobAuth(address address,string timestamp,uint256 nonce,string message)".getBytes(StandardCharsets.UTF_8));

    private final byte[] orderDomainSeparator;
    private final byte[] authDomainSeparator;

    public PolymarketSigner(long chainId) {
        BigInteger chain = BigInteger.valueOf(chainId);
        this.orderDomainSeparator = Hash.sha3(concat(
                ORDER_DOMAIN_TYPEHASH,
                keccak("Polymarket CTF Exchange"),
                keccak("1"),
                Numeric.toBytesPadded(chain, 32),
                address(EXCHANGE_ADDRESS)));
        this.authDomainSeparator = Hash.sha3(concat(
                AUTH_DOMAIN_TYPEHASH,
                keccak("ClobAuthDomain"),
                keccak("1"),
                Numeric.toBytesPadded(chain, 32)));
    }

    @Data
    @Builder
    public static class Order {
        private BigInteger salt;
        private String maker;
        private String signer;
        private String taker;
        private BigInteger tokenId;
        private BigInteger makerAmount;
        private BigInteger takerAmount;
        private BigInteger expiration;
        private BigInteger nonce;
        private BigInteger feeRateBps;
        private int side; // 0 = BUY, 1 = SELL
        private int signatureType; // 0 = EOA
    }

    public String signOrder(Order order, Credentials credentials) {
        return sign(orderDigest(order), credentials);
    }

    public String signClobAuth(Credentials credentials, long timestamp, long nonce) {
        return sign(clobAuthDigest(credentials.getAddress(), timestamp, nonce), credentials);
    }

    byte[] orderDigest(Order o) {
        byte[] hashStruct = Hash.sha3(concat(
                ORDER_TYPEHASH,
                Numeric.toBytesPadded(o.salt, 32),
                address(o.maker),
                address(o.signer),
                address(o.taker),
                Numeric.toBytesPadded(o.tokenId, 32),
                Numeric.toBytesPadded(o.makerAmount, 32),
                Numeric.toBytesPadded(o.takerAmount, 32),
                Numeric.toBytesPadded(o.expiration, 32),
                Numeric.toBytesPadded(o.nonce, 32),
                Numeric.toBytesPadded(o.feeRateBps, 32),
                Numeric.toBytesPadded(BigInteger.valueOf(o.side), 32),
                Numeric.toBytesPadded(BigInteger.valueOf(o.signatureType), 32)));
        return typedDataHash(orderDomainSeparator, hashStruct);
    }

    byte[] clobAuthDigest(String address, long timestamp, long nonce) {
        byte[] hashStruct = Hash.sha3(concat(
                CLOB_AUTH_TYPEHASH,
                address(address),
                keccak(String.valueOf(timestamp)),
                Numeric.toBytesPadded(BigInteger.valueOf(nonce), 32),
                keccak(CLOB_AUTH_MESSAGE)));
        return typedDataHash(authDomainSeparator, hashStruct);
    }

    // keccak256("\x19\x01" ‖ domainSeparator ‖ hashStruct(message))
    private static byte[] typedDataHash(byte[] domainSeparator, byte[] hashStruct) {
        ByteBuffer buffer = ByteBuffer.allocate(2 + 32 + 32);
        buffer.put((byte) 0x19);
        buffer.put((byte) 0x01);
        buffer.put(domainSeparator);
        buffer.put(hashStruct);
        return Hash.sha3(buffer.array());
    }

    // r ‖ s ‖ v, v in {27, 28}
    private static String sign(byte[] digest, Credentials credentials) {
        Sign.SignatureData signatureData = Sign.signMessage(digest, credentials.getEcKeyPair(), false);
        ByteBuffer sigBuffer = ByteBuffer.allocate(65);
        sigBuffer.put(signatureData.getR());
        sigBuffer.put(signatureData.getS());
        sigBuffer.put(signatureData.getV());
        return Numeric.toHexString(sigBuffer.array());
    }

    private static byte[] keccak(String value) {
        return Hash.sha3(value.getBytes(StandardCharsets.UTF_8));
    }

    private static byte[] address(String hex) {
        return Numeric.toBytesPadded(Numeric.toBigInt(hex), 32);
    }

    private static byte[] concat(byte[]... arrays) {
        int totalLength = Arrays.stream(arrays).mapToInt(a -> a.length).sum();
        ByteBuffer buffer = ByteBuffer.allocate(totalLength);
        for (byte[] array : arrays) {
            buffer.put(array);
        }
        return buffer.array();
    }
}
