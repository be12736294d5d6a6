package com.bit.vote.api;

import com.bit.vote.aop.annotation.PermissionsAnnotation;
import com.bit.vote.common.Address;
import com.bit.vote.ledger.TokenService;
import com.bit.vote.result.Result;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@Slf4j
@RestController
@RequestMapping("/token")
public class TokenApi {

    @Autowired
    private TokenService tokenService;

    // 增发 仅管理员
    @PermissionsAnnotation
    @PostMapping("/mint")
    public Result<Long> mint(@RequestParam("caller") String caller,
                             @RequestParam("to") String to,
                             @RequestParam("amount") long amount) {
        Address toAddress = Address.fromBase58(to);
        tokenService.mint(Address.fromBase58(caller), toAddress, amount);
        return Result.OK(tokenService.balanceOf(toAddress));
    }

    @PostMapping("/transfer")
    public Result<Long> transfer(@RequestParam("caller") String caller,
                                 @RequestParam("to") String to,
                                 @RequestParam("amount") long amount) {
        Address from = Address.fromBase58(caller);
        tokenService.transfer(from, Address.fromBase58(to), amount);
        return Result.OK(tokenService.balanceOf(from));
    }

    @PostMapping("/approve")
    public Result<Long> approve(@RequestParam("caller") String caller,
                                @RequestParam("spender") String spender,
                                @RequestParam("amount") long amount) {
        Address owner = Address.fromBase58(caller);
        Address spenderAddress = Address.fromBase58(spender);
        tokenService.approve(owner, spenderAddress, amount);
        return Result.OK(tokenService.allowance(owner, spenderAddress));
    }

    @GetMapping("/balance")
    public Result<Long> balance(@RequestParam("owner") String owner) {
        return Result.OK(tokenService.balanceOf(Address.fromBase58(owner)));
    }

    @GetMapping("/allowance")
    public Result<Long> allowance(@RequestParam("owner") String owner,
                                  @RequestParam("spender") String spender) {
        return Result.OK(tokenService.allowance(Address.fromBase58(owner), Address.fromBase58(spender)));
    }
}
